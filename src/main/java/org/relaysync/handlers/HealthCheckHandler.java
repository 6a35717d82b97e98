package org.relaysync.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.engine.JobScheduler;
import org.relaysync.utils.ResponseUtil;
import org.relaysync.utils.security.KeyProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for health check endpoint.
 * Returns  -  basic app info,
 *          -  scheduler timezone and number of scheduled jobs.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    private final JobScheduler scheduler;

    public HealthCheckHandler(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "RelaySync REST API");
        response.put("version", "1.0.0");
        response.put("environment", KeyProvider.getEnvironment());
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());
        response.put("timezone", scheduler.getZone().getId());
        response.put("scheduled_jobs", scheduler.scheduledCount());

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}
