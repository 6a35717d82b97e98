package org.relaysync.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.relaysync.model.AdminAuth;
import org.relaysync.model.Job;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of a full configuration write. A null {@code auth} or {@code timezone} leaves the stored value alone;
 * the job map is authoritative, so jobs it does not name are deleted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigUpdate(
        @JsonProperty("auth") AdminAuth auth,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("jobs") Map<String, Job> jobs) {

    public ConfigUpdate {
        jobs = jobs == null ? new LinkedHashMap<>() : jobs;
    }
}
