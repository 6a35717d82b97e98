package org.relaysync.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers preflights and echoes allowed origins for the admin UI. The session cookie needs
 * credentials, so a matching origin is echoed back rather than "*".
 */
public class CORSHandler implements HttpHandler {

    private static final String ALLOWED_METHODS = "GET, POST, PUT, DELETE, OPTIONS";
    private static final String ALLOWED_HEADERS = "Authorization, Content-Type, Accept, X-Request-Id";
    private static final String MAX_AGE_SECONDS = "86400";

    private final HttpHandler next;
    private final Set<String> origins;
    private final boolean anyOrigin;

    public CORSHandler(HttpHandler next, String allowedOrigins) {
        this.next = next;
        this.origins = allowedOrigins == null ? Set.of()
                : Arrays.stream(allowedOrigins.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> s.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        this.anyOrigin = origins.contains("*");
    }

    boolean isAllowed(String origin) {
        return origin != null && (anyOrigin || origins.contains(origin.toLowerCase(Locale.ROOT)));
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        boolean allowed = isAllowed(origin);

        if (allowed) {
            HeaderMap headers = exchange.getResponseHeaders();
            headers.put(new HttpString("Access-Control-Allow-Origin"), origin);
            headers.put(new HttpString("Access-Control-Allow-Credentials"), "true");
            headers.put(new HttpString("Access-Control-Allow-Methods"), ALLOWED_METHODS);
            headers.put(new HttpString("Access-Control-Allow-Headers"), ALLOWED_HEADERS);
            headers.put(new HttpString("Access-Control-Max-Age"), MAX_AGE_SECONDS);
            headers.put(Headers.VARY, "Origin");
        }

        if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(allowed ? StatusCodes.NO_CONTENT : StatusCodes.FORBIDDEN);
            exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, "0");
            exchange.endExchange();
            return;
        }

        next.handleRequest(exchange);
    }
}
