package org.relaysync.client.dns;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DnsRecord(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("content") String content,
        @JsonProperty("ttl") int ttl,
        @JsonProperty("proxied") boolean proxied) {
}
