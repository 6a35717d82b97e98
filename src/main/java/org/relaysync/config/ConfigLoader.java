package org.relaysync.config;

import org.relaysync.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;


public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CLASSPATH_DEFAULT = "config.xml";

    private ConfigLoader() {}

    /**
     * Loads config.xml from the given path, falling back to the copy bundled on the classpath
     * when the file does not exist.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        try {
            Path path = Path.of(xmlPath);
            if (Files.isRegularFile(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    logger.info("Loading configuration from {}", path.toAbsolutePath());
                    return load(in);
                }
            }

            logger.warn("{} not found, using bundled defaults", xmlPath);
            try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_DEFAULT)) {
                if (in == null) {
                    return new XmlConfiguration();
                }
                return load(in);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    static XmlConfiguration load(InputStream in) throws Exception {
        Document doc = XmlUtil.parse(in);
        XmlConfiguration cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
        applyDefaults(cfg);
        return cfg;
    }

    /**
     * Sections left out of the file unmarshal as null; give them their defaults.
     */
    private static void applyDefaults(XmlConfiguration cfg) {
        if (cfg.server == null) cfg.server = new XmlConfiguration.Server();
        if (cfg.store == null) cfg.store = new XmlConfiguration.Store();
        if (cfg.scheduler == null) cfg.scheduler = new XmlConfiguration.Scheduler();
        if (cfg.http == null) cfg.http = new XmlConfiguration.Http();
        if (cfg.cloudflare == null) cfg.cloudflare = new XmlConfiguration.Cloudflare();
        if (cfg.telegram == null) cfg.telegram = new XmlConfiguration.Telegram();
        if (cfg.jwtConfig == null) cfg.jwtConfig = new XmlConfiguration.JwtConfig();

        if (cfg.scheduler.poolSize < 1) {
            throw new IllegalArgumentException("scheduler.poolSize must be at least 1");
        }
        if (cfg.http.timeoutSeconds < 1 || cfg.http.timeoutSeconds > 30) {
            throw new IllegalArgumentException("http.timeoutSeconds must be between 1 and 30");
        }
    }

}
