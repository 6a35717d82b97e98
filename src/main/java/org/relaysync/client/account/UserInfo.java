package org.relaysync.client.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subscription details from {@code /api/v1/user/info}. Byte counts and speed are raw panel values;
 * {@code expire} is epoch millis, 0 meaning no expiry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserInfo(
        @JsonProperty("username") String username,
        @JsonProperty("group_name") String groupName,
        @JsonProperty("plan_name") String planName,
        @JsonProperty("expire") long expire,
        @JsonProperty("renew_price") String renewPrice,
        @JsonProperty("balance") String balance,
        @JsonProperty("traffic_used") long trafficUsed,
        @JsonProperty("traffic_enable") long trafficEnable,
        @JsonProperty("max_rules") int maxRules,
        @JsonProperty("speed_limit") long speedLimit) {
}
