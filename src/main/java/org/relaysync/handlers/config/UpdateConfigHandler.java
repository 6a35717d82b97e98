package org.relaysync.handlers.config;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.service.ConfigUpdate;
import org.relaysync.service.JobAdminService;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;

import java.util.Map;

/**
 * Replaces the whole configuration. Masked secrets in the body keep their stored values.
 */
public class UpdateConfigHandler implements HttpHandler {

    private final JobAdminService jobs;

    public UpdateConfigHandler(JobAdminService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) return;

        ConfigUpdate update = HttpRequestUtil.bind(exchange, body, ConfigUpdate.class);
        if (update == null) return;

        ConfigSnapshot saved = jobs.replaceConfig(update);
        ResponseUtil.sendSuccess(exchange, "Configuration saved", saved);
    }
}
