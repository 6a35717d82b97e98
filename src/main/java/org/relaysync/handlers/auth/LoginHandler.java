package org.relaysync.handlers.auth;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.relaysync.service.AuthService;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;
import org.relaysync.utils.security.CookieUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class LoginHandler implements HttpHandler {

    private final AuthService authService;

    public LoginHandler(AuthService authService) {
        this.authService = authService;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) return;

        String username = HttpRequestUtil.getString(body, "username");
        String password = HttpRequestUtil.getString(body, "password");
        if (username == null || password == null) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "username and password are required");
            return;
        }

        Optional<String> token = authService.login(username.trim(), password);
        if (token.isEmpty()) {
            ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "Invalid username or password");
            return;
        }

        long ttl = authService.getAccessTokenTtlSeconds();
        CookieUtil.setAccessTokenCookie(exchange, token.get(), ttl);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("username", username.trim());
        data.put("expires_in", ttl);
        ResponseUtil.sendSuccess(exchange, "Login successful", data);
    }
}
