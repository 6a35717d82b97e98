package org.relaysync.engine;

import org.relaysync.config.utils.LogContext;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.Job;
import org.relaysync.store.ConfigStore;
import org.relaysync.store.ConfigStoreException;
import org.relaysync.utils.ZoneUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JobScheduler keeps one fixed-rate timer per schedulable job and runs jobs on a bounded worker pool.
 * <p>
 * Timers only request runs; the runs themselves go through the per-job {@link JobSlot}, so a timer
 * fire and any number of manual triggers never overlap for the same job. Timers are reconciled
 * against the stored job set with {@link #reload(Map)} whenever that set changes; no restart needed.
 */
public class JobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final ConfigStore store;
    private final JobRunner runner;
    private final TimeUnit intervalUnit;
    private final ZoneId defaultZone;

    private final ScheduledThreadPoolExecutor timers;
    private final ThreadPoolExecutor workers;

    // guarded by this
    private final Map<String, ScheduledEntry> scheduled = new HashMap<>();
    private ZoneId zone;

    private final ConcurrentHashMap<String, JobSlot> slots = new ConcurrentHashMap<>();

    private record ScheduledEntry(int interval, ScheduledFuture<?> future) {}

    public JobScheduler(ConfigStore store, JobRunner runner, int poolSize, ZoneId defaultZone) {
        this(store, runner, poolSize, defaultZone, TimeUnit.MINUTES);
    }

    /**
     * @param intervalUnit unit of a job's {@code interval_minutes}; anything but MINUTES is for tests
     */
    public JobScheduler(ConfigStore store, JobRunner runner, int poolSize, ZoneId defaultZone, TimeUnit intervalUnit) {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be at least 1");
        this.store = store;
        this.runner = runner;
        this.defaultZone = defaultZone;
        this.intervalUnit = intervalUnit;

        this.timers = new ScheduledThreadPoolExecutor(1, named("job-timer"));
        this.timers.setRemoveOnCancelPolicy(true);

        // fixed size, unbounded FIFO queue for runs beyond the pool size
        this.workers = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), named("job-worker"));
    }

    /**
     * Re-reads the store and converges timers on it. A timezone change rebuilds every timer.
     * When the store cannot be read the current timers are kept.
     */
    public synchronized ReloadSummary reloadFromStore() {
        ConfigSnapshot snapshot;
        try {
            snapshot = store.getSnapshot();
        } catch (ConfigStoreException e) {
            logger.error("Job store unavailable, keeping {} current timers: {}", scheduled.size(), e.getMessage(), e);
            return ReloadSummary.none();
        }
        setTimezone(ZoneUtil.resolve(snapshot.timezone(), defaultZone));
        return reload(snapshot.jobs());
    }

    /**
     * Declarative reconciliation: timers of missing or unschedulable jobs are cancelled, new ones
     * created, and those whose interval changed re-created. Calling it again with the same jobs changes
     * nothing. Cancelling a timer never interrupts a run already executing.
     */
    public synchronized ReloadSummary reload(Map<String, Job> jobs) {
        Map<String, Integer> desired = new LinkedHashMap<>();
        jobs.forEach((id, job) -> {
            if (job != null && job.isSchedulable()) {
                desired.put(id, job.getIntervalMinutes());
            }
        });

        int removed = 0;
        for (String id : new ArrayList<>(scheduled.keySet())) {
            if (!desired.containsKey(id)) {
                scheduled.remove(id).future().cancel(false);
                removed++;
                logger.info("Timer removed for job {}", id);
            }
        }

        int added = 0;
        int rescheduled = 0;
        for (Map.Entry<String, Integer> e : desired.entrySet()) {
            ScheduledEntry current = scheduled.get(e.getKey());
            if (current == null) {
                schedule(e.getKey(), e.getValue());
                added++;
            } else if (current.interval() != e.getValue()) {
                current.future().cancel(false);
                schedule(e.getKey(), e.getValue());
                rescheduled++;
            }
        }

        // idle slots of deleted jobs are dropped; a busy slot stays until its run is over
        for (String id : new ArrayList<>(slots.keySet())) {
            if (!jobs.containsKey(id)) {
                slots.computeIfPresent(id, (k, slot) -> slot.state() == JobSlot.State.IDLE ? null : slot);
            }
        }

        ReloadSummary summary = new ReloadSummary(added, removed, rescheduled);
        if (summary.changed()) {
            logger.info("Timers reloaded: +{} -{} ~{}, {} scheduled", added, removed, rescheduled, scheduled.size());
        }
        return summary;
    }

    /**
     * @return true if the zone changed and timers were rebuilt
     */
    public synchronized boolean setTimezone(ZoneId newZone) {
        if (newZone.equals(zone)) {
            return false;
        }
        ZoneId previous = zone;
        zone = newZone;
        if (previous == null) {
            logger.info("Scheduler timezone set to {}", newZone);
            return false;
        }
        logger.info("Timezone changed {} -> {}, rebuilding {} timers", previous, newZone, scheduled.size());
        Map<String, Integer> intervals = new LinkedHashMap<>();
        scheduled.forEach((id, entry) -> intervals.put(id, entry.interval()));
        scheduled.values().forEach(entry -> entry.future().cancel(false));
        scheduled.clear();
        intervals.forEach(this::schedule);
        return true;
    }

    /**
     * Requests a run now. Never blocks and never starts a second concurrent run of the same job.
     */
    public TriggerOutcome trigger(String jobId) {
        TriggerOutcome[] outcome = new TriggerOutcome[1];
        JobSlot slot = slots.compute(jobId, (k, existing) -> {
            JobSlot s = existing != null ? existing : new JobSlot();
            outcome[0] = s.request();
            return s;
        });
        if (outcome[0] == TriggerOutcome.QUEUED) {
            submit(jobId, slot);
        }
        logger.debug("Trigger for job {}: {}", jobId, outcome[0]);
        return outcome[0];
    }

    private void schedule(String jobId, int interval) {
        ScheduledFuture<?> future = timers.scheduleAtFixedRate(() -> fire(jobId), interval, interval, intervalUnit);
        scheduled.put(jobId, new ScheduledEntry(interval, future));
        logger.info("Scheduling job {} every {} {}", jobId, interval, intervalUnit.name().toLowerCase());
    }

    // an exception escaping a fixed-rate task would silently cancel its timer
    private void fire(String jobId) {
        try {
            trigger(jobId);
        } catch (RuntimeException e) {
            logger.error("Timer fire for job {} failed: {}", jobId, e.getMessage(), e);
        }
    }

    private void submit(String jobId, JobSlot slot) {
        try {
            workers.execute(() -> runSlot(jobId, slot));
        } catch (RejectedExecutionException e) {
            slot.reset();
            logger.warn("Run of job {} rejected, scheduler is shutting down", jobId);
        }
    }

    private void runSlot(String jobId, JobSlot slot) {
        slot.begin();
        try {
            LogContext.startJobRun(jobId);
            long start = System.currentTimeMillis();
            RunResult result = runner.run(jobId);
            logger.info("Run of job {} finished in {}ms: status={}, dns={}, notification={}",
                    jobId, System.currentTimeMillis() - start, result.status(), result.dns(), result.notification());
        } catch (ConfigStoreException e) {
            logger.error("Job store unavailable, run of job {} abandoned until next cycle: {}", jobId, e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Error in run of job {}: {}", jobId, e.getMessage(), e);
        } finally {
            LogContext.clear();
            if (slot.finish()) {
                submit(jobId, slot);
            }
        }
    }

    public synchronized Map<String, Integer> scheduledIntervals() {
        Map<String, Integer> out = new LinkedHashMap<>();
        scheduled.forEach((id, entry) -> out.put(id, entry.interval()));
        return out;
    }

    public synchronized int scheduledCount() {
        return scheduled.size();
    }

    public synchronized ZoneId getZone() {
        return zone != null ? zone : defaultZone;
    }

    public JobSlot.State stateOf(String jobId) {
        JobSlot slot = slots.get(jobId);
        return slot == null ? JobSlot.State.IDLE : slot.state();
    }

    synchronized ScheduledFuture<?> timerOf(String jobId) {
        ScheduledEntry entry = scheduled.get(jobId);
        return entry == null ? null : entry.future();
    }

    /**
     * Cancels all timers, stops accepting runs and waits up to {@code grace} for runs in flight.
     * Runs still going after that are interrupted and abandoned; store writes are atomic so this
     * leaves the store either before or after their result.
     */
    public void shutdown(Duration grace) {
        logger.info("Shutting down JobScheduler...");
        synchronized (this) {
            scheduled.values().forEach(entry -> entry.future().cancel(false));
            scheduled.clear();
        }
        timers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = workers.shutdownNow();
                logger.warn("JobScheduler did not terminate gracefully, {} queued runs dropped", dropped.size());
            } else {
                logger.info("JobScheduler stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            logger.warn("JobScheduler shutdown interrupted.");
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
