package org.relaysync.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.service.JobAdminService;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;

public class DeleteJobHandler implements HttpHandler {

    private final JobAdminService jobs;

    public DeleteJobHandler(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String jobId = HttpRequestUtil.pathParam(exchange, "jobId");
        jobs.deleteJob(jobId);
        ResponseUtil.sendSuccess(exchange, "Job deleted", null);
    }
}
