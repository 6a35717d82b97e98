package org.relaysync.service;

import org.relaysync.engine.JobScheduler;
import org.relaysync.engine.TriggerOutcome;
import org.relaysync.model.AdminAuth;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.Job;
import org.relaysync.store.ConfigStore;
import org.relaysync.utils.ZoneUtil;
import org.relaysync.utils.security.PasswordUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Administrative reads and writes of the job set. Every write is one atomic store update merged
 * against the latest stored state, followed by a scheduler reload.
 */
public class JobAdminService {

    private static final Logger logger = LoggerFactory.getLogger(JobAdminService.class);

    private final ConfigStore store;
    private final JobScheduler scheduler;
    private final JobIds ids;

    public JobAdminService(ConfigStore store, JobScheduler scheduler, JobIds ids) {
        this.store = store;
        this.scheduler = scheduler;
        this.ids = ids;
    }

    public ConfigSnapshot getConfig() {
        return masked(store.getSnapshot());
    }

    /**
     * Replaces auth, timezone and the job set. Jobs missing from {@code incoming} are deleted;
     * a null auth or timezone keeps the stored one.
     */
    public ConfigSnapshot replaceConfig(ConfigUpdate incoming) {
        if (incoming.timezone() != null && !ZoneUtil.isValid(incoming.timezone())) {
            throw new ValidationException("Invalid timezone", List.of(incoming.timezone()));
        }

        ConfigSnapshot written = store.update(current -> {
            AdminAuth auth = mergeAuth(incoming.auth(), current.auth());
            String timezone = incoming.timezone() != null ? incoming.timezone().trim() : current.timezone();

            Map<String, Job> jobs = new LinkedHashMap<>();
            incoming.jobs().forEach((id, job) -> {
                if (id == null || id.isBlank() || job == null) {
                    throw new ValidationException("Job entries need an id and a body");
                }
                Job merged = CredentialMasking.merge(job, current.jobs().get(id));
                validate(id, merged);
                jobs.put(id, merged);
            });
            return new ConfigSnapshot(auth, timezone, jobs);
        });

        logger.info("Configuration replaced: {} jobs, timezone {}", written.jobs().size(), written.timezone());
        scheduler.reloadFromStore();
        return masked(written);
    }

    public StoredJob createJob(Job incoming) {
        String[] id = new String[1];
        ConfigSnapshot written = store.update(current -> {
            String candidate = ids.next();
            while (current.jobs().containsKey(candidate)) {
                candidate = ids.next();
            }
            Job merged = CredentialMasking.merge(incoming, null);
            validate(candidate, merged);
            current.jobs().put(candidate, merged);
            id[0] = candidate;
            return current;
        });

        logger.info("Job {} created", id[0]);
        scheduler.reloadFromStore();
        return new StoredJob(id[0], CredentialMasking.mask(written.jobs().get(id[0])));
    }

    public StoredJob getJob(String jobId) {
        Job job = store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return new StoredJob(jobId, CredentialMasking.mask(job));
    }

    public StoredJob updateJob(String jobId, Job incoming) {
        Job[] stored = new Job[1];
        boolean found = store.updateJob(jobId, previous -> {
            Job merged = CredentialMasking.merge(incoming, previous);
            validate(jobId, merged);
            stored[0] = merged;
            return merged;
        });
        if (!found) {
            throw new JobNotFoundException(jobId);
        }

        logger.info("Job {} updated", jobId);
        scheduler.reloadFromStore();
        return new StoredJob(jobId, CredentialMasking.mask(stored[0]));
    }

    public void deleteJob(String jobId) {
        store.update(current -> {
            if (current.jobs().remove(jobId) == null) {
                throw new JobNotFoundException(jobId);
            }
            return current;
        });
        logger.info("Job {} deleted", jobId);
        scheduler.reloadFromStore();
    }

    /**
     * Queues a run and returns at once; the result shows up later in the job's last_log and last_run.
     */
    public TriggerOutcome triggerRun(String jobId) {
        if (store.findJob(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        TriggerOutcome outcome = scheduler.trigger(jobId);
        logger.info("Manual run of job {}: {}", jobId, outcome);
        return outcome;
    }

    private static AdminAuth mergeAuth(AdminAuth incoming, AdminAuth previous) {
        if (incoming == null) {
            return previous;
        }
        AdminAuth merged = CredentialMasking.merge(incoming, previous);
        List<String> invalid = new ArrayList<>();
        if (merged.username() == null || merged.username().isBlank()) invalid.add("auth.username");
        if (merged.password() == null || merged.password().isBlank()) invalid.add("auth.password");
        if (!invalid.isEmpty()) {
            throw new ValidationException("Admin credentials must not be blank", invalid);
        }
        if (!merged.password().equals(previous.password()) && !PasswordUtil.isHashed(merged.password())) {
            merged = new AdminAuth(merged.username(), PasswordUtil.hashPassword(merged.password()));
        }
        return merged;
    }

    static void validate(String jobId, Job job) {
        List<String> invalid = new ArrayList<>();
        if (job.getIntervalMinutes() < 1) invalid.add("interval_minutes");
        if (job.getUsername() == null || job.getUsername().isBlank()) invalid.add("username");
        String host = job.getProviderHost();
        if (host == null || !(host.trim().startsWith("http://") || host.trim().startsWith("https://"))) {
            invalid.add("provider_host");
        }
        if (!invalid.isEmpty()) {
            throw new ValidationException("Invalid job " + jobId, invalid);
        }
    }

    private static ConfigSnapshot masked(ConfigSnapshot snapshot) {
        Map<String, Job> jobs = new LinkedHashMap<>();
        snapshot.jobs().forEach((id, job) -> jobs.put(id, CredentialMasking.mask(job)));
        return new ConfigSnapshot(CredentialMasking.mask(snapshot.auth()), snapshot.timezone(), jobs);
    }
}
