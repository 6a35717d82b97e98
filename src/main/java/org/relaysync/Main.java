package org.relaysync;

import io.undertow.Undertow;
import org.relaysync.client.HttpJsonClient;
import org.relaysync.client.account.PanelAccountClient;
import org.relaysync.client.dns.CloudflareDnsClient;
import org.relaysync.config.ConfigLoader;
import org.relaysync.config.XmlConfiguration;
import org.relaysync.config.utils.LogContext;
import org.relaysync.engine.JobExecutor;
import org.relaysync.engine.JobScheduler;
import org.relaysync.notifications.MessageTemplates;
import org.relaysync.notifications.telegram.TelegramSender;
import org.relaysync.rest.AppContext;
import org.relaysync.rest.RestApiServer;
import org.relaysync.service.AuthService;
import org.relaysync.service.JobAdminService;
import org.relaysync.service.JobIds;
import org.relaysync.service.RuleDomainService;
import org.relaysync.store.JsonFileConfigStore;
import org.relaysync.utils.ZoneUtil;
import org.relaysync.utils.security.KeyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Entry point
 * Load Configuration from Xml
 * Open the job store (bootstrap it when missing)
 * Wire clients, executor and scheduler, then start the admin API
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting RelaySync ------------]");

            // loads .env and switches logging to the dev setup when asked
            logger.debug("Environment: {}", KeyProvider.getEnvironment());

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            ZoneId defaultZone = ZoneUtil.resolve(cfg.scheduler.defaultTimezone, ZoneId.of("Asia/Shanghai"));

            JsonFileConfigStore store = new JsonFileConfigStore(Path.of(cfg.store.path), defaultZone.getId());
            store.initializeIfMissing();
            logger.info("Job store: {}", store.getFile().toAbsolutePath());

            HttpJsonClient http = new HttpJsonClient(Duration.ofSeconds(cfg.http.timeoutSeconds), cfg.http.userAgent);
            PanelAccountClient accounts = new PanelAccountClient(http, Duration.ofSeconds(cfg.http.logoutTimeoutSeconds));
            CloudflareDnsClient dns = new CloudflareDnsClient(http, cfg.cloudflare.apiUrl);
            TelegramSender telegram = new TelegramSender(cfg.telegram, http);

            JobExecutor executor = new JobExecutor(store, accounts, dns, telegram, new MessageTemplates(),
                    Clock.systemDefaultZone(), defaultZone);
            JobScheduler scheduler = new JobScheduler(store, executor, cfg.scheduler.poolSize, defaultZone);

            logger.info("[------------ Loading job timers ------------]");
            scheduler.reloadFromStore();

            AppContext ctx = new AppContext(
                    cfg,
                    new JobAdminService(store, scheduler, new JobIds(Clock.systemUTC())),
                    new RuleDomainService(store),
                    new AuthService(store, cfg.jwtConfig.accessTokenTtlMinutes * 60),
                    scheduler);

            logger.info("[------------ Starting Undertow server ------------]");
            Undertow server = RestApiServer.start(ctx);

            Duration grace = Duration.ofSeconds(Math.max(0, cfg.scheduler.shutdownGraceSeconds));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                server.stop();
                scheduler.shutdown(grace);
                logger.info("[------------ RelaySync shutdown complete ------------]");
            }, "shutdown-hook"));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }
}
