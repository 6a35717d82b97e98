package org.relaysync.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.model.Job;
import org.relaysync.service.JobAdminService;
import org.relaysync.service.StoredJob;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;

import java.util.Map;

/**
 * Replaces a job's definition. Secrets sent masked or left out keep their stored values;
 * results and rule domains are never taken from the body.
 */
public class UpdateJobHandler implements HttpHandler {

    private final JobAdminService jobs;

    public UpdateJobHandler(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String jobId = HttpRequestUtil.pathParam(exchange, "jobId");
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) return;

        Job job = HttpRequestUtil.bind(exchange, body, Job.class);
        if (job == null) return;

        StoredJob updated = jobs.updateJob(jobId, job);
        ResponseUtil.sendSuccess(exchange, "Job updated", updated);
    }
}
