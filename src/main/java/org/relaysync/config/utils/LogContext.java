package org.relaysync.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by logback.xml. Every thread sets its own context and clears it in a finally block:
 * the main thread on startup, a worker per job run, and a worker per admin request.
 */
public class LogContext {

    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";
    public static final String JOB_ID = "job.id";

    private LogContext() {}

    public static void start(String component) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, UUID.randomUUID().toString());
    }

    public static void startJobRun(String jobId) {
        start("JobRun");
        MDC.put(JOB_ID, jobId);
    }

    /** Admin requests reuse an incoming X-Request-Id so a UI can correlate its calls. */
    public static void startRequest(String requestId) {
        MDC.put(COMPONENT, "RestApi");
        MDC.put(TRACE_ID, requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId);
    }

    public static void clear() {
        MDC.clear();
    }
}
