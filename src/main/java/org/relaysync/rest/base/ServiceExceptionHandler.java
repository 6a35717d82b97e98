package org.relaysync.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.relaysync.config.utils.LogContext;
import org.relaysync.service.JobNotFoundException;
import org.relaysync.service.ValidationException;
import org.relaysync.store.ConfigStoreException;
import org.relaysync.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exceptions thrown by the admin services to error responses. Runs on the worker thread,
 * so the request's log context is set and cleared here.
 */
public class ServiceExceptionHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ServiceExceptionHandler.class);

    private final HttpHandler next;

    public ServiceExceptionHandler(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        LogContext.startRequest(exchange.getRequestHeaders().getFirst("X-Request-Id"));
        try {
            next.handleRequest(exchange);
        } catch (JobNotFoundException e) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, e.getMessage());
        } catch (ValidationException e) {
            ResponseUtil.sendInvalid(exchange, e.getMessage(), e.getInvalid());
        } catch (ConfigStoreException e) {
            logger.error("Job store unavailable: {}", e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Job store unavailable");
        } catch (Exception e) {
            logger.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal Server Error");
        } finally {
            LogContext.clear();
        }
    }
}
