package org.relaysync.store;

import org.relaysync.model.AdminAuth;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.Job;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * ConfigStore for tests. Same copy-on-read semantics as the file store, plus a switch to make
 * every call fail.
 */
public class InMemoryConfigStore implements ConfigStore {

    private ConfigSnapshot snapshot;
    private volatile boolean failing;
    private final AtomicInteger writes = new AtomicInteger();

    public InMemoryConfigStore() {
        this(new ConfigSnapshot(new AdminAuth("admin", "secret"), "UTC", new LinkedHashMap<>()));
    }

    public InMemoryConfigStore(ConfigSnapshot initial) {
        this.snapshot = initial.copy();
    }

    public synchronized InMemoryConfigStore put(String id, Job job) {
        snapshot.jobs().put(id, job.copy());
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int writeCount() {
        return writes.get();
    }

    @Override
    public synchronized ConfigSnapshot getSnapshot() {
        checkAvailable();
        return snapshot.copy();
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(getSnapshot().jobs().get(jobId));
    }

    @Override
    public synchronized boolean updateJob(String jobId, UnaryOperator<Job> patch) {
        checkAvailable();
        ConfigSnapshot next = snapshot.copy();
        Job job = next.jobs().get(jobId);
        if (job == null) {
            return false;
        }
        next.jobs().put(jobId, patch.apply(job));
        snapshot = next;
        writes.incrementAndGet();
        return true;
    }

    @Override
    public synchronized ConfigSnapshot update(UnaryOperator<ConfigSnapshot> mutation) {
        checkAvailable();
        ConfigSnapshot next = mutation.apply(snapshot.copy());
        snapshot = next.copy();
        writes.incrementAndGet();
        return next.copy();
    }

    private void checkAvailable() {
        if (failing) {
            throw new ConfigStoreException("store offline", new IOException("disk gone"));
        }
    }
}
