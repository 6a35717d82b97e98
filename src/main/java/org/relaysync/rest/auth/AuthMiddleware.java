package org.relaysync.rest.auth;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.StatusCodes;
import org.relaysync.service.AuthService;
import org.relaysync.utils.ResponseUtil;
import org.relaysync.utils.security.CookieUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects requests without a valid admin session and attaches the admin name to the exchange.
 */
public class AuthMiddleware implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(AuthMiddleware.class);

    public static final AttachmentKey<String> ADMIN = AttachmentKey.create(String.class);

    private final HttpHandler next;
    private final AuthService authService;

    public AuthMiddleware(HttpHandler next, AuthService authService) {
        this.next = next;
        this.authService = authService;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String accessToken = CookieUtil.readAccessToken(exchange);
        if (accessToken == null) {
            ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "No active session. Please login.");
            return;
        }

        String admin = authService.authenticate(accessToken);
        if (admin == null) {
            log.debug("Rejected expired or invalid access token on {}", exchange.getRequestURI());
            ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "Session expired or does not exist. Please login.");
            return;
        }

        exchange.putAttachment(ADMIN, admin);
        next.handleRequest(exchange);
    }
}
