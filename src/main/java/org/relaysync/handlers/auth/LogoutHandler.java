package org.relaysync.handlers.auth;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.relaysync.utils.ResponseUtil;
import org.relaysync.utils.security.CookieUtil;

/**
 * Sessions are stateless; logging out only drops the cookie.
 */
public class LogoutHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        CookieUtil.clearAccessTokenCookie(exchange);
        ResponseUtil.sendSuccess(exchange, "Logged out successfully", null);
    }
}
