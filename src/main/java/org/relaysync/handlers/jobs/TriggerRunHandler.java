package org.relaysync.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.engine.TriggerOutcome;
import org.relaysync.service.JobAdminService;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts a run in the background. The response only says whether it was queued;
 * the outcome lands in the job's last_log and last_run.
 */
public class TriggerRunHandler implements HttpHandler {

    private final JobAdminService jobs;

    public TriggerRunHandler(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String jobId = HttpRequestUtil.pathParam(exchange, "jobId");
        TriggerOutcome outcome = jobs.triggerRun(jobId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("outcome", outcome);
        ResponseUtil.sendAccepted(exchange, "Run requested", data);
    }
}
