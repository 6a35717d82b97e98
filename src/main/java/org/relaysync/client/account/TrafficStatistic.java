package org.relaysync.client.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrafficStatistic(
        @JsonProperty("traffic_today") long trafficToday,
        @JsonProperty("traffic_yesterday") long trafficYesterday) {

    public static TrafficStatistic empty() {
        return new TrafficStatistic(0, 0);
    }
}
