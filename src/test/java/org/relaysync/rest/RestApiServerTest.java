package org.relaysync.rest;

import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.relaysync.config.XmlConfiguration;
import org.relaysync.engine.JobScheduler;
import org.relaysync.engine.RunResult;
import org.relaysync.model.AdminAuth;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.service.AuthService;
import org.relaysync.service.JobAdminService;
import org.relaysync.service.JobIds;
import org.relaysync.service.RuleDomainService;
import org.relaysync.store.InMemoryConfigStore;
import org.relaysync.utils.JsonUtil;

import java.net.CookieManager;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RestApiServerTest {

    private static final String JOB_BODY = "{\"username\":\"relay-user\",\"password\":\"relay-pass\","
            + "\"provider_host\":\"https://panel.example\",\"dns_token\":\"cf-token\",\"domain\":\"relay.example.com\","
            + "\"interval_minutes\":15}";

    private InMemoryConfigStore store;
    private JobScheduler scheduler;
    private Undertow server;
    private HttpClient http;
    private String base;
    private final AtomicInteger runs = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore(new ConfigSnapshot(new AdminAuth("admin", "secret"), "UTC", new LinkedHashMap<>()));
        scheduler = new JobScheduler(store, id -> {
            runs.incrementAndGet();
            return RunResult.skipped(id, OffsetDateTime.now());
        }, 2, ZoneId.of("UTC"));

        XmlConfiguration cfg = new XmlConfiguration();
        cfg.server.host = "127.0.0.1";
        cfg.server.port = 0;
        cfg.server.ioThreads = 1;
        cfg.server.workerThreads = 4;

        AppContext ctx = new AppContext(cfg,
                new JobAdminService(store, scheduler, new JobIds(Clock.systemUTC())),
                new RuleDomainService(store),
                new AuthService(store, 1800),
                scheduler);
        server = RestApiServer.start(ctx);

        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        base = "http://127.0.0.1:" + port + "/api";
        http = HttpClient.newBuilder().cookieHandler(new CookieManager()).connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        scheduler.shutdown(Duration.ofSeconds(1));
    }

    private HttpResponse<String> call(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(base + path)).timeout(Duration.ofSeconds(5));
        builder.method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return JsonUtil.mapper().readTree(response.body());
    }

    private void login() throws Exception {
        HttpResponse<String> response = call("POST", "/auth/login", "{\"username\":\"admin\",\"password\":\"secret\"}");
        assertThat(response.statusCode()).isEqualTo(200);
    }

    private String createJob() throws Exception {
        HttpResponse<String> response = call("POST", "/jobs", JOB_BODY);
        assertThat(response.statusCode()).isEqualTo(201);
        return json(response).path("data").path("id").asText();
    }

    @Nested
    @DisplayName("Sessions")
    class Sessions {

        @Test
        @DisplayName("health is public and reports the scheduler")
        void health() throws Exception {
            HttpResponse<String> response = call("GET", "/system/health", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).path("data").path("timezone").asText()).isEqualTo("UTC");
        }

        @Test
        @DisplayName("preflights from a configured origin are answered, others refused")
        void preflight() throws Exception {
            HttpRequest.Builder preflight = HttpRequest.newBuilder(URI.create(base + "/jobs"))
                    .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                    .header("Access-Control-Request-Method", "POST");

            HttpResponse<String> allowed = http.send(preflight.copy().header("Origin", "http://localhost:5000").build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> refused = http.send(preflight.copy().header("Origin", "http://evil.example").build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(allowed.statusCode()).isEqualTo(204);
            assertThat(allowed.headers().firstValue("Access-Control-Allow-Origin")).contains("http://localhost:5000");
            assertThat(refused.statusCode()).isEqualTo(403);
        }

        @Test
        @DisplayName("admin routes need a session")
        void unauthorized() throws Exception {
            HttpResponse<String> response = call("GET", "/config", null);

            assertThat(response.statusCode()).isEqualTo(401);
            assertThat(json(response).path("status").asText()).isEqualTo("error");
        }

        @Test
        @DisplayName("wrong credentials are refused, right ones set the session cookie")
        void login() throws Exception {
            assertThat(call("POST", "/auth/login", "{\"username\":\"admin\",\"password\":\"nope\"}").statusCode())
                    .isEqualTo(401);

            HttpResponse<String> ok = call("POST", "/auth/login", "{\"username\":\"admin\",\"password\":\"secret\"}");

            assertThat(ok.statusCode()).isEqualTo(200);
            assertThat(ok.headers().firstValue("Set-Cookie")).hasValueSatisfying(c -> assertThat(c).startsWith("accessToken="));
            assertThat(call("GET", "/config", null).statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("logout drops the session")
        void logout() throws Exception {
            login();

            assertThat(call("POST", "/auth/logout", null).statusCode()).isEqualTo(200);
            assertThat(call("GET", "/config", null).statusCode()).isEqualTo(401);
        }
    }

    @Nested
    @DisplayName("Jobs")
    class Jobs {

        @BeforeEach
        void session() throws Exception {
            login();
        }

        @Test
        @DisplayName("create, read, update and delete a job with masked secrets")
        void lifecycle() throws Exception {
            // create
            String id = createJob();
            assertThat(scheduler.scheduledIntervals()).containsEntry(id, 15);

            // read
            JsonNode job = json(call("GET", "/jobs/" + id, null)).path("data").path("job");
            assertThat(job.path("password").asText()).isEqualTo("********");
            assertThat(job.path("dns_token").asText()).isEqualTo("********");

            // update with the masked body
            String edited = JOB_BODY.replace("relay-pass", "********").replace("cf-token", "********")
                    .replace("\"interval_minutes\":15", "\"interval_minutes\":30");
            assertThat(call("PUT", "/jobs/" + id, edited).statusCode()).isEqualTo(200);
            assertThat(store.findJob(id).orElseThrow().getPassword()).isEqualTo("relay-pass");
            assertThat(scheduler.scheduledIntervals()).containsEntry(id, 30);

            // delete
            assertThat(call("DELETE", "/jobs/" + id, null).statusCode()).isEqualTo(200);
            assertThat(call("GET", "/jobs/" + id, null).statusCode()).isEqualTo(404);
            assertThat(scheduler.scheduledCount()).isZero();
        }

        @Test
        @DisplayName("invalid bodies are 400 with the offending fields")
        void invalid() throws Exception {
            HttpResponse<String> response = call("POST", "/jobs", "{\"username\":\"\",\"provider_host\":\"panel\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).path("invalid").toString()).contains("username", "provider_host");
            assertThat(call("POST", "/jobs", "{not json").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("a manual run is accepted and queued")
        void trigger() throws Exception {
            String id = createJob();

            HttpResponse<String> response = call("POST", "/run/" + id, null);

            assertThat(response.statusCode()).isEqualTo(202);
            assertThat(json(response).path("data").path("outcome").asText()).isIn("QUEUED", "COALESCED");
            assertThat(call("POST", "/run/unknown", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("the full config can be read and written back unchanged")
        void configRoundTrip() throws Exception {
            String id = createJob();
            JsonNode config = json(call("GET", "/config", null)).path("data");

            HttpResponse<String> response = call("POST", "/config", config.toString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(store.getSnapshot().auth()).isEqualTo(new AdminAuth("admin", "secret"));
            assertThat(store.findJob(id).orElseThrow().getDnsToken()).isEqualTo("cf-token");
        }

        @Test
        @DisplayName("unknown routes are 404 and wrong methods 405")
        void routing() throws Exception {
            assertThat(call("GET", "/nothing", null).statusCode()).isEqualTo(404);
            assertThat(call("PATCH", "/jobs/1", "{}").statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("Rule domains")
    class RuleDomains {

        @Test
        @DisplayName("domains are set, read, validated and cleared per rule")
        void crud() throws Exception {
            login();
            String id = createJob();
            String path = "/domains/" + id + "/7";

            assertThat(call("POST", path, "{\"domains\":[\"a.example.com\",\"b.example.com\"]}").statusCode()).isEqualTo(200);
            assertThat(json(call("GET", path, null)).path("data").path("domains").toString())
                    .isEqualTo("[\"a.example.com\",\"b.example.com\"]");

            HttpResponse<String> bad = call("POST", path, "{\"domains\":[\"ok.example.com\",\"not a domain\"]}");
            assertThat(bad.statusCode()).isEqualTo(400);
            assertThat(json(bad).path("invalid").toString()).isEqualTo("[\"not a domain\"]");

            assertThat(call("POST", path, "{\"domains\":\"a.example.com\"}").statusCode()).isEqualTo(400);

            assertThat(call("DELETE", path, null).statusCode()).isEqualTo(200);
            assertThat(json(call("GET", path, null)).path("data").path("domains").size()).isZero();
        }
    }
}
