package org.relaysync.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.model.Job;
import org.relaysync.service.JobAdminService;
import org.relaysync.service.StoredJob;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;

import java.util.Map;

public class CreateJobHandler implements HttpHandler {

    private final JobAdminService jobs;

    public CreateJobHandler(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) return;

        Job job = HttpRequestUtil.bind(exchange, body, Job.class);
        if (job == null) return;

        StoredJob created = jobs.createJob(job);
        ResponseUtil.sendCreated(exchange, "Job created", created);
    }
}
