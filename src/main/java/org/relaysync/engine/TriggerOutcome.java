package org.relaysync.engine;

/**
 * What a trigger request did. At most one run per job is active and at most one more waits behind it.
 */
public enum TriggerOutcome {
    /** The job was idle; a run was handed to the worker pool. */
    QUEUED,
    /** A run was already waiting to start, or a follow-up was already pending. Nothing new was queued. */
    COALESCED,
    /** A run is executing; one follow-up run will start when it finishes. */
    FOLLOW_UP_QUEUED
}
