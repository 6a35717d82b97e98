package org.relaysync.store;

import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.Job;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable job store. Every mutation is a read-modify-write against the latest stored state,
 * applied atomically; nothing is ever written back from a stale read.
 * <p>
 * All methods throw {@link ConfigStoreException} when the backing storage cannot be read or written.
 */
public interface ConfigStore {

    /**
     * @return a deep copy of the current content
     */
    ConfigSnapshot getSnapshot();

    Optional<Job> findJob(String jobId);

    /**
     * Applies {@code patch} to a copy of the stored job and replaces it in one atomic step.
     *
     * @return false when no job with that id exists (nothing is written)
     */
    boolean updateJob(String jobId, UnaryOperator<Job> patch);

    /**
     * Applies {@code mutation} to a copy of the whole snapshot and replaces it in one atomic step.
     *
     * @return the snapshot as written
     */
    ConfigSnapshot update(UnaryOperator<ConfigSnapshot> mutation);
}
