package org.relaysync.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.jetbrains.annotations.NotNull;
import org.relaysync.config.XmlConfiguration;
import org.relaysync.rest.base.CORSHandler;
import org.relaysync.rest.base.Dispatcher;
import org.relaysync.rest.base.FallBack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    /**
     * Builds and starts the admin API. The caller owns the returned server and stops it on shutdown.
     */
    public static Undertow start(AppContext ctx) {
        XmlConfiguration cfg = ctx.cfg();
        if (cfg == null || cfg.server == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }

        String base = normalizeBasePath(cfg.server.basePath == null ? "" : cfg.server.basePath);

        PathHandler pathHandler = Handlers.path(new Dispatcher(new FallBack()))
                .addPrefixPath(base + "/auth", Routes.auth(ctx))
                .addPrefixPath(base + "/system", Routes.system(ctx))
                .addPrefixPath(base + "/config", Routes.config(ctx))
                .addPrefixPath(base + "/jobs", Routes.jobs(ctx))
                .addPrefixPath(base + "/run", Routes.run(ctx))
                .addPrefixPath(base + "/domains", Routes.domains(ctx));

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(cfg.server.ioThreads)
                .setWorkerThreads(cfg.server.workerThreads)
                .addHttpListener(cfg.server.port, cfg.server.host)
                .setHandler(new CORSHandler(pathHandler, cfg.server.allowedOrigins))
                .build();

        server.start();
        logger.info("""
                        \s
                        RELAYSYNC REST API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        """,
                cfg.server.host, cfg.server.port, base);
        return server;
    }

    static String normalizeBasePath(@NotNull String basePath) {
        String trimmed = basePath.trim();
        if (trimmed.isEmpty() || "/".equals(trimmed)) return "";
        if (!trimmed.startsWith("/")) trimmed = "/" + trimmed;
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
