package org.relaysync.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.relaysync.rest.auth.AuthMiddleware;
import org.relaysync.service.AuthService;

public class RouteUtils {

    private RouteUtils() {}

    /**
     * Route that does not require authentication.
     * Anyone can access this route.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(
                new BlockingHandler(
                        new ServiceExceptionHandler(handler)
                )
        );
    }

    /**
     * Route that requires a valid admin session (JWT cookie or bearer token).
     */
    public static HttpHandler userSessionRequired(HttpHandler handler, AuthService authService) {
        return new Dispatcher(
                new BlockingHandler(
                        new AuthMiddleware(new ServiceExceptionHandler(handler), authService)
                )
        );
    }
}
