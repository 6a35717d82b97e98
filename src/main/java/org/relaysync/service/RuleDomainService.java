package org.relaysync.service;

import org.relaysync.model.Job;
import org.relaysync.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Domain names curated per forward rule. Plain bookkeeping on the job's rule_domains; no DNS calls.
 */
public class RuleDomainService {

    private static final Logger logger = LoggerFactory.getLogger(RuleDomainService.class);

    public static final int MAX_DOMAINS = 500;
    private static final Pattern DOMAIN =
            Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9._-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z]{2,})+$");

    private final ConfigStore store;

    public RuleDomainService(ConfigStore store) {
        this.store = store;
    }

    public List<String> get(String jobId, String ruleId) {
        Job job = store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        List<String> domains = job.getRuleDomains().get(ruleId);
        return domains == null ? new ArrayList<>() : new ArrayList<>(domains);
    }

    /**
     * Replaces the rule's list. Every entry must be a domain name string; the order is kept.
     */
    public List<String> set(String jobId, String ruleId, List<?> domains) {
        if (domains == null) {
            throw new ValidationException("domains must be a list");
        }
        List<Object> invalid = new ArrayList<>();
        List<String> accepted = new ArrayList<>();
        for (Object entry : domains) {
            if (entry instanceof String && DOMAIN.matcher((String) entry).matches()) {
                accepted.add((String) entry);
            } else {
                invalid.add(entry);
            }
        }
        if (!invalid.isEmpty()) {
            throw new ValidationException("invalid domains", invalid);
        }
        if (accepted.size() > MAX_DOMAINS) {
            throw new ValidationException("too many domains, at most " + MAX_DOMAINS + " per rule");
        }

        boolean found = store.updateJob(jobId, job -> {
            job.getRuleDomains().put(ruleId, new ArrayList<>(accepted));
            return job;
        });
        if (!found) {
            throw new JobNotFoundException(jobId);
        }
        logger.info("Job {} rule {}: {} domains saved", jobId, ruleId, accepted.size());
        return accepted;
    }

    public void clear(String jobId, String ruleId) {
        boolean found = store.updateJob(jobId, job -> {
            job.getRuleDomains().remove(ruleId);
            return job;
        });
        if (!found) {
            throw new JobNotFoundException(jobId);
        }
        logger.info("Job {} rule {}: domains cleared", jobId, ruleId);
    }

    public static boolean isValidDomain(String value) {
        return value != null && DOMAIN.matcher(value).matches();
    }
}
