package org.relaysync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full store content: global settings plus every job keyed by id.
 * Mirrors the on-disk document; {@link #copy()} is deep so callers may mutate freely.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigSnapshot(
        @JsonProperty("auth") AdminAuth auth,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("jobs") Map<String, Job> jobs) {

    public ConfigSnapshot {
        auth = auth == null ? AdminAuth.empty() : auth;
        jobs = jobs == null ? new LinkedHashMap<>() : jobs;
    }

    public ConfigSnapshot copy() {
        Map<String, Job> jobsCopy = new LinkedHashMap<>();
        jobs.forEach((id, job) -> jobsCopy.put(id, job.copy()));
        return new ConfigSnapshot(auth, timezone, jobsCopy);
    }

    public ConfigSnapshot withJobs(Map<String, Job> newJobs) {
        return new ConfigSnapshot(auth, timezone, newJobs);
    }

    public ConfigSnapshot withSettings(AdminAuth newAuth, String newTimezone) {
        return new ConfigSnapshot(newAuth, newTimezone, jobs);
    }
}
