package org.relaysync.handlers.config;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.service.JobAdminService;
import org.relaysync.utils.ResponseUtil;

public class GetConfigHandler implements HttpHandler {

    private final JobAdminService jobs;

    public GetConfigHandler(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendSuccess(exchange, "Configuration fetched", jobs.getConfig());
    }
}
