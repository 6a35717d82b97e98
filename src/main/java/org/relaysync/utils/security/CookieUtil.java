package org.relaysync.utils.security;

import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.Cookie;
import io.undertow.util.Headers;

public final class CookieUtil {

    public static final String ACCESS_TOKEN_COOKIE = "accessToken";

    private CookieUtil() {}

    public static void setAccessTokenCookie(HttpServerExchange exchange,
                                            String accessToken,
                                            long accessTokenTtlSeconds) {
        StringBuilder sb = new StringBuilder();
        sb.append(ACCESS_TOKEN_COOKIE).append('=').append(accessToken)
                .append("; Path=/; HttpOnly; Max-Age=").append(accessTokenTtlSeconds).append(';');
        sb.append(" SameSite=Lax;");
        if (isSecure(exchange)) sb.append(" Secure;");

        exchange.getResponseHeaders().add(Headers.SET_COOKIE, sb.toString());
    }

    public static void clearAccessTokenCookie(HttpServerExchange exchange) {
        exchange.getResponseHeaders().add(Headers.SET_COOKIE,
                ACCESS_TOKEN_COOKIE + "=; Path=/; HttpOnly; Max-Age=0; SameSite=Lax;");
    }

    public static String readAccessToken(HttpServerExchange exchange) {
        Cookie cookie = exchange.getRequestCookie(ACCESS_TOKEN_COOKIE);
        if (cookie != null && cookie.getValue() != null && !cookie.getValue().isBlank()) {
            return cookie.getValue();
        }
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return header.substring(7).trim();
        }
        return null;
    }

    private static boolean isSecure(HttpServerExchange exchange) {
        if ("https".equalsIgnoreCase(exchange.getRequestScheme())) return true;
        if (KeyProvider.isDev()) return false;
        String host = exchange.getRequestHeaders().getFirst(Headers.HOST);
        return host != null && !host.startsWith("localhost") && !host.startsWith("127.0.0.1");
    }
}
