package org.relaysync.engine;

/**
 * Runs one job to completion on the calling thread.
 */
@FunctionalInterface
public interface JobRunner {

    /**
     * @throws org.relaysync.store.ConfigStoreException when the job store is unavailable
     */
    RunResult run(String jobId);
}
