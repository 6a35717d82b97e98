package org.relaysync.utils.security;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Secrets and the runtime environment, read from the process environment first and from
 * a .env file in the working directory second.
 * <p>
 * APP_ENV=DEVELOPMENT switches Logback to logback-dev.xml. JWT_SIGNING_KEY signs the admin
 * session tokens; when it is absent a random key is generated for the lifetime of the process.
 */
public class KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(KeyProvider.class);

    public static final String ENV_JWT_SIGNING_KEY = "JWT_SIGNING_KEY";
    private static final String ENV_ENVIRONMENT = "APP_ENV";
    private static final String DEVELOPMENT = "DEVELOPMENT";
    private static final int MIN_KEY_LENGTH = 32;

    private static final Map<String, String> secrets = new ConcurrentHashMap<>();
    private static volatile Dotenv dotenv;
    private static volatile String environment;

    private KeyProvider() {}

    private static Dotenv dotenv() {
        Dotenv loaded = dotenv;
        if (loaded == null) {
            synchronized (KeyProvider.class) {
                if (dotenv == null) {
                    dotenv = Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load();
                }
                loaded = dotenv;
            }
        }
        return loaded;
    }

    /**
     * Resolves an optional setting. Returns null when neither the environment nor .env defines it.
     */
    public static String find(String name) {
        String cached = secrets.get(name);
        if (cached != null) return cached;

        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            value = dotenv().get(name);
        }
        if (value == null || value.isBlank()) return null;

        String trimmed = value.trim();
        secrets.put(name, trimmed);
        logger.debug("'{}' resolved ({} chars)", name, trimmed.length());
        return trimmed;
    }

    /**
     * HS256 needs at least 256 bits. Without a configured key every restart invalidates
     * the sessions issued by the previous process.
     */
    public static String getJwtSigningKey() {
        String configured = find(ENV_JWT_SIGNING_KEY);
        if (configured != null && configured.length() >= MIN_KEY_LENGTH) {
            return configured;
        }
        if (configured != null) {
            logger.warn("{} is shorter than {} characters, using a generated key instead",
                    ENV_JWT_SIGNING_KEY, MIN_KEY_LENGTH);
        }
        return secrets.computeIfAbsent(ENV_JWT_SIGNING_KEY + ".generated", k -> {
            logger.warn("{} not set, sessions will not survive a restart", ENV_JWT_SIGNING_KEY);
            byte[] bytes = new byte[48];
            new SecureRandom().nextBytes(bytes);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        });
    }

    /**
     * PRODUCTION unless APP_ENV says otherwise. The first call also picks the Logback configuration.
     */
    public static String getEnvironment() {
        String env = environment;
        if (env == null) {
            synchronized (KeyProvider.class) {
                if (environment == null) {
                    String configured = find(ENV_ENVIRONMENT);
                    environment = configured == null ? "PRODUCTION" : configured.toUpperCase();
                    if (DEVELOPMENT.equals(environment)) {
                        reconfigureLogback("logback-dev.xml");
                    }
                    logger.info("Environment: {}", environment);
                }
                env = environment;
            }
        }
        return env;
    }

    public static boolean isDev() {
        return DEVELOPMENT.equals(getEnvironment());
    }

    private static void reconfigureLogback(String resource) {
        URL url = KeyProvider.class.getClassLoader().getResource(resource);
        if (url == null) {
            logger.warn("Logback configuration {} not found on the classpath", resource);
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(url);
        } catch (JoranException e) {
            // the status printer below reports what went wrong
            logger.error("Failed to apply {}", resource, e);
        }
        StatusPrinter.printInCaseOfErrorsOrWarnings(context);
    }
}
