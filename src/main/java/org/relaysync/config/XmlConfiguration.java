package org.relaysync.config;

import jakarta.xml.bind.annotation.XmlRootElement;

/**
 * Process configuration bound from config.xml. Job definitions are not here; they live in
 * the job store file named by {@link Store#path}.
 */
@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server = new Server();
    public Store store = new Store();
    public Scheduler scheduler = new Scheduler();
    public Http http = new Http();
    public Cloudflare cloudflare = new Cloudflare();
    public Telegram telegram = new Telegram();
    public JwtConfig jwtConfig = new JwtConfig();

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host = "0.0.0.0";
        public int port = 5000;
        public int ioThreads = 2;
        public int workerThreads = 16;
        public String basePath = "/api";
        public String allowedOrigins = "http://localhost:5000";
    }

    // --- Job store ---
    @XmlRootElement(name = "store")
    public static class Store {
        public String path = "config.json";
    }

    @XmlRootElement(name = "scheduler")
    public static class Scheduler {
        public int poolSize = 10;
        public String defaultTimezone = "Asia/Shanghai";
        public int shutdownGraceSeconds = 30;
    }

    // --- Outbound HTTP ---
    @XmlRootElement(name = "http")
    public static class Http {
        public int timeoutSeconds = 30;
        public int logoutTimeoutSeconds = 5;
        public String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    }

    @XmlRootElement(name = "cloudflare")
    public static class Cloudflare {
        public String apiUrl = "https://api.cloudflare.com/client/v4";
    }

    @XmlRootElement(name = "telegram")
    public static class Telegram {
        public String apiUrl = "https://api.telegram.org";
        public String parseMode = "HTML";
        public int retryAttempts = 2;
        public int retryDelayMillis = 1000;
    }

    @XmlRootElement(name = "jwtConfig")
    public static class JwtConfig {
        public long accessTokenTtlMinutes = 30;
    }
}
