package org.relaysync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Device group as reported by the panel. {@code connectHost} is the address clients dial
 * for rules whose inbound side is this group.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceGroup(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("connect_host") String connectHost) {
}
