package org.relaysync.client.account;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.relaysync.client.ClientException;
import org.relaysync.client.ClientException.FailureKind;
import org.relaysync.client.HttpJsonClient;
import org.relaysync.model.DeviceGroup;
import org.relaysync.model.ForwardRule;
import org.relaysync.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link AccountClient} for the relay panel REST API ({@code /api/v1}).
 * <p>
 * Every reply is an envelope {@code {"code":0,"data":...}}; a non-zero code is a failure even on HTTP 200.
 */
public class PanelAccountClient implements AccountClient {

    private static final Logger logger = LoggerFactory.getLogger(PanelAccountClient.class);

    private static final String API = "/api/v1";
    private static final double GIB = 1024d * 1024d * 1024d;

    private final HttpJsonClient http;
    private final Duration logoutTimeout;
    private final ObjectMapper mapper = JsonUtil.mapper();

    public PanelAccountClient(HttpJsonClient http, Duration logoutTimeout) {
        this.http = http;
        this.logoutTimeout = logoutTimeout;
    }

    @Override
    public AccountSession login(String host, String username, String password) throws ClientException {
        String base = normalizeHost(host);
        Map<String, String> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("password", password);

        JsonNode reply = http.post(uri(base, "/auth/login"), browserHeaders(base, null), body);
        int code = reply.path("code").asInt(-1);
        if (code != 0) {
            throw new ClientException(FailureKind.UNAUTHORIZED,
                    "Login rejected by " + hostOf(base) + ": code " + code + " " + message(reply));
        }
        String token = reply.path("data").asText("");
        if (token.isBlank()) {
            throw new ClientException(FailureKind.MALFORMED, "Login reply from " + hostOf(base) + " carried no token");
        }
        return new AccountSession(base, token);
    }

    @Override
    public List<DeviceGroup> deviceGroups(AccountSession session) throws ClientException {
        JsonNode data = data(get(session, "/user/devicegroup"), "device groups");
        return convert(data, new TypeReference<List<DeviceGroup>>() {}, "device groups");
    }

    @Override
    public UserInfo userInfo(AccountSession session) throws ClientException {
        JsonNode data = data(get(session, "/user/info"), "user info");
        return convert(data, new TypeReference<UserInfo>() {}, "user info");
    }

    @Override
    public TrafficStatistic trafficStatistic(AccountSession session) throws ClientException {
        JsonNode data = data(get(session, "/user/statistic"), "traffic statistic");
        return convert(data, new TypeReference<TrafficStatistic>() {}, "traffic statistic");
    }

    @Override
    public List<ForwardRule> forwardRules(AccountSession session, Map<Long, DeviceGroup> groups) throws ClientException {
        JsonNode data = data(get(session, "/user/forward?page=1&size=100"), "forward rules");
        if (!data.isArray()) {
            throw new ClientException(FailureKind.MALFORMED, "Forward rules reply is not a list");
        }
        List<ForwardRule> rules = new ArrayList<>();
        for (JsonNode item : data) {
            if (!item.hasNonNull("id")) {
                throw new ClientException(FailureKind.MALFORMED, "Forward rule without id: " + item);
            }
            Long groupIn = item.hasNonNull("device_group_in") ? item.get("device_group_in").asLong() : null;
            DeviceGroup group = groupIn == null || groups == null ? null : groups.get(groupIn);

            rules.add(new ForwardRule(
                    item.get("id").asLong(),
                    item.path("name").asText(""),
                    item.path("listen_port").asInt(),
                    destinations(item.path("config")),
                    item.path("status").asInt(),
                    toGib(item.path("traffic_used").asLong(0)),
                    item.path("display_updated_at").asText(""),
                    groupIn,
                    group != null ? group.name() : "ID " + groupIn,
                    group != null && group.connectHost() != null ? group.connectHost() : ""));
        }
        return rules;
    }

    @Override
    public void logout(AccountSession session) throws ClientException {
        http.post(uri(session.host(), "/auth/logout"), browserHeaders(session.host(), session.token()), null, logoutTimeout);
    }

    private JsonNode get(AccountSession session, String path) throws ClientException {
        return http.get(uri(session.host(), path), browserHeaders(session.host(), session.token()));
    }

    private JsonNode data(JsonNode reply, String what) throws ClientException {
        int code = reply.path("code").asInt(-1);
        if (code != 0) {
            throw new ClientException(FailureKind.MALFORMED,
                    "Panel refused " + what + ": code " + code + " " + message(reply));
        }
        JsonNode data = reply.get("data");
        if (data == null || data.isNull()) {
            throw new ClientException(FailureKind.MALFORMED, "Panel reply for " + what + " has no data");
        }
        return data;
    }

    private <T> T convert(JsonNode data, TypeReference<T> type, String what) throws ClientException {
        try {
            return mapper.convertValue(data, type);
        } catch (IllegalArgumentException e) {
            throw new ClientException(FailureKind.MALFORMED, "Unexpected " + what + " shape: " + e.getMessage(), e);
        }
    }

    /**
     * The rule config is a JSON document embedded as a string; only its {@code dest} list is kept.
     */
    private String destinations(JsonNode config) {
        try {
            JsonNode parsed = config.isTextual() ? mapper.readTree(config.asText()) : config;
            List<String> dest = new ArrayList<>();
            parsed.path("dest").forEach(d -> dest.add(d.asText()));
            return String.join(", ", dest);
        } catch (Exception e) {
            logger.debug("Unparseable rule config: {}", e.getMessage());
            return "unparseable";
        }
    }

    private static double toGib(long bytes) {
        return BigDecimal.valueOf(bytes / GIB).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String message(JsonNode reply) {
        JsonNode msg = reply.hasNonNull("msg") ? reply.get("msg") : reply.path("message");
        return msg.asText("unknown error");
    }

    /**
     * The panel sits behind an anti-bot filter that rejects requests without browser-like Origin/Referer.
     */
    private static Map<String, String> browserHeaders(String base, String token) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Origin", base);
        headers.put("Referer", base + "/");
        if (token != null) {
            headers.put("Authorization", token);
        }
        return headers;
    }

    private static URI uri(String base, String path) throws ClientException {
        try {
            return URI.create(base + API + path);
        } catch (IllegalArgumentException e) {
            throw new ClientException(FailureKind.MALFORMED, "Invalid provider host: " + base, e);
        }
    }

    static String normalizeHost(String host) throws ClientException {
        if (host == null || host.isBlank()) {
            throw new ClientException(FailureKind.MALFORMED, "Provider host is not configured");
        }
        String base = host.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static String hostOf(String base) {
        return base.replaceFirst("^https?://", "");
    }
}
