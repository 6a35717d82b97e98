package org.relaysync.service;

import org.relaysync.model.Job;

/**
 * A job together with its id, as returned to callers (secrets masked).
 */
public record StoredJob(String id, Job job) {
}
