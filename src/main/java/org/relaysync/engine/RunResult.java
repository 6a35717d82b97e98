package org.relaysync.engine;

import java.time.OffsetDateTime;
import java.util.List;

public record RunResult(
        String jobId,
        RunStatus status,
        DnsOutcome dns,
        NotifyOutcome notification,
        RunError error,
        List<String> log,
        OffsetDateTime finishedAt) {

    public static RunResult skipped(String jobId, OffsetDateTime at) {
        return new RunResult(jobId, RunStatus.SKIPPED, DnsOutcome.NOT_ATTEMPTED, NotifyOutcome.NOT_REQUIRED,
                null, List.of(), at);
    }
}
