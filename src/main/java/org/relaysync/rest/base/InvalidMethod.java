package org.relaysync.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.relaysync.utils.ResponseUtil;

/**
 * Handles unsupported HTTP methods
 * */
public class InvalidMethod implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                "Method " + exchange.getRequestMethod() + " not allowed on " + exchange.getRequestURI());
    }
}
