package org.relaysync.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.io.InputStream;
import java.util.Deque;
import java.util.Map;

/**
 * Parsing JSON bodies and reading path parameters.
 */
public class HttpRequestUtil {

    private HttpRequestUtil() {}

    /**
     * Reads the request body as a JSON object. On failure a 400 is sent and null returned,
     * so handlers only need to check for null.
     */
    public static Map<String, Object> parseJson(HttpServerExchange exchange) {
        try (InputStream is = exchange.getInputStream()) {
            Map<String, Object> body = JsonUtil.mapper().readValue(is, new TypeReference<Map<String, Object>>() {});
            if (body == null) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON: empty body");
            }
            return body;
        } catch (Exception e) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
            return null;
        }
    }

    /**
     * Path parameters declared on a RoutingHandler template ("/{jobId}") land in the query parameters.
     */
    public static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.getFirst();
        return value == null || value.isBlank() ? null : value;
    }

    public static String getString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return null;
    }

    public static <T> T convert(Object value, Class<T> type) {
        return JsonUtil.mapper().convertValue(value, type);
    }

    /**
     * Binds a parsed body to {@code type}. On a shape mismatch a 400 is sent and null returned.
     */
    public static <T> T bind(HttpServerExchange exchange, Object value, Class<T> type) {
        try {
            T bound = convert(value, type);
            if (bound == null) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid request body");
            }
            return bound;
        } catch (IllegalArgumentException e) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid request body: " + e.getMessage());
            return null;
        }
    }
}
