package org.relaysync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ForwardRule(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("listen_port") int listenPort,
        @JsonProperty("dest") String dest,
        @JsonProperty("status") int status,
        @JsonProperty("traffic_gib") double trafficGib,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("device_group_in") Long deviceGroupIn,
        @JsonProperty("device_group_name") String deviceGroupName,
        @JsonProperty("device_group_connect") String deviceGroupConnect) {
}
