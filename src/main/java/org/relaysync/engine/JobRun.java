package org.relaysync.engine;

import org.relaysync.model.DeviceGroup;
import org.relaysync.model.ForwardRule;
import org.relaysync.model.Job;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * In-flight state of one run. Confined to the worker thread executing it and never persisted as such.
 */
class JobRun {

    private final String jobId;
    private final Job job;
    private final ZoneId zone;
    private final RunLog log;

    private DnsOutcome dns = DnsOutcome.NOT_ATTEMPTED;
    private NotifyOutcome notification = NotifyOutcome.NOT_REQUIRED;
    private RunError error;

    // set once the account fetch completed
    private boolean accountFetched;
    private String userInfo;
    private List<ForwardRule> forwardRules;
    private List<DeviceGroup> deviceGroups;

    JobRun(String jobId, Job job, ZoneId zone, RunLog log) {
        this.jobId = jobId;
        this.job = job;
        this.zone = zone;
        this.log = log;
    }

    void log(String message) {
        log.add(message);
    }

    void fail(RunError runError, String message) {
        this.error = runError;
        log.add(message);
    }

    void recordAccount(String info, List<ForwardRule> rules, List<DeviceGroup> groups) {
        this.accountFetched = true;
        this.userInfo = info;
        this.forwardRules = rules;
        this.deviceGroups = groups;
    }

    RunResult finish(OffsetDateTime finishedAt) {
        RunStatus status = error == null ? RunStatus.SUCCESS : RunStatus.FAILED;
        return new RunResult(jobId, status, dns, notification, error, log.lines(), finishedAt);
    }

    String jobId() { return jobId; }
    Job job() { return job; }
    ZoneId zone() { return zone; }
    RunLog runLog() { return log; }

    void dns(DnsOutcome outcome) { this.dns = outcome; }
    void notification(NotifyOutcome outcome) { this.notification = outcome; }
    RunError error() { return error; }

    boolean accountFetched() { return accountFetched; }
    String userInfo() { return userInfo; }
    List<ForwardRule> forwardRules() { return forwardRules; }
    List<DeviceGroup> deviceGroups() { return deviceGroups; }
}
