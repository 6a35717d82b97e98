package org.relaysync.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ResponseUtil {
    private static final Logger logger = LoggerFactory.getLogger(ResponseUtil.class);

    private static final ObjectMapper mapper = JsonUtil.mapper();

    private ResponseUtil() {}

    public static void sendJson(HttpServerExchange exchange, int status, Map<String, Object> body) {
        try {
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=UTF-8");
            String json = mapper.writeValueAsString(body);
            exchange.getResponseSender().send(json);

            logger.debug("Response sent. Status: {}, Body: {}", status, json);
        } catch (Exception e) {
            logger.error("Failed to send JSON response. Status: {}. Exception: {}", status, e.getMessage(), e);
        }
    }

    public static void sendError(HttpServerExchange exchange, int status, String message) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("status", "error");
        res.put("message", message);
        sendJson(exchange, status, res);
    }

    /**
     * Validation failures carry the offending values so the caller can point at them.
     */
    public static void sendInvalid(HttpServerExchange exchange, String message, List<?> invalid) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("status", "error");
        res.put("message", message);
        if (invalid != null && !invalid.isEmpty()) {
            res.put("invalid", invalid);
        }
        sendJson(exchange, StatusCodes.BAD_REQUEST, res);
    }

    public static void sendSuccess(HttpServerExchange exchange, String message, Object data) {
        sendWithStatus(exchange, StatusCodes.OK, message, data);
    }

    public static void sendCreated(HttpServerExchange exchange, String message, Object data) {
        sendWithStatus(exchange, StatusCodes.CREATED, message, data);
    }

    public static void sendAccepted(HttpServerExchange exchange, String message, Object data) {
        sendWithStatus(exchange, StatusCodes.ACCEPTED, message, data);
    }

    private static void sendWithStatus(HttpServerExchange exchange, int status, String message, Object data) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("status", "success");
        res.put("message", message);
        if (data != null) {
            res.put("data", data);
        }
        sendJson(exchange, status, res);
    }
}
