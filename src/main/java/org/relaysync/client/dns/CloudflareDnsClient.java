package org.relaysync.client.dns;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.relaysync.client.ClientException;
import org.relaysync.client.ClientException.FailureKind;
import org.relaysync.client.HttpJsonClient;
import org.relaysync.utils.JsonUtil;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DnsClient} for the Cloudflare v4 API. Replies are {@code {"success":..,"errors":[..],"result":..}};
 * {@code success:false} is treated as a malformed reply.
 */
public class CloudflareDnsClient implements DnsClient {

    private final HttpJsonClient http;
    private final String apiUrl;
    private final ObjectMapper mapper = JsonUtil.mapper();

    public CloudflareDnsClient(HttpJsonClient http, String apiUrl) {
        this.http = http;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
    }

    @Override
    public Optional<String> findZoneId(String token, String zoneName) throws ClientException {
        JsonNode result = result(http.get(uri("/zones?name=" + encode(zoneName)), auth(token)), "zone lookup");
        if (!result.isArray() || result.isEmpty()) {
            return Optional.empty();
        }
        String id = result.get(0).path("id").asText("");
        return id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    @Override
    public Optional<DnsRecord> findRecord(String token, String zoneId, String name) throws ClientException {
        String path = "/zones/" + zoneId + "/dns_records?type=A&name=" + encode(name);
        JsonNode result = result(http.get(uri(path), auth(token)), "record lookup");
        if (!result.isArray() || result.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toRecord(result.get(0)));
    }

    @Override
    public DnsRecord updateRecord(String token, String zoneId, DnsRecord record, String content, int ttl)
            throws ClientException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "A");
        body.put("name", record.name());
        body.put("content", content);
        body.put("ttl", ttl);
        body.put("proxied", record.proxied());

        JsonNode result = result(http.put(uri("/zones/" + zoneId + "/dns_records/" + record.id()), auth(token), body),
                "record update");
        if (result.isObject()) {
            return toRecord(result);
        }
        return new DnsRecord(record.id(), "A", record.name(), content, ttl, record.proxied());
    }

    private JsonNode result(JsonNode reply, String what) throws ClientException {
        if (!reply.path("success").asBoolean(false)) {
            throw new ClientException(FailureKind.MALFORMED,
                    "Cloudflare " + what + " failed: " + reply.path("errors"));
        }
        return reply.path("result");
    }

    private DnsRecord toRecord(JsonNode node) throws ClientException {
        try {
            return mapper.treeToValue(node, DnsRecord.class);
        } catch (Exception e) {
            throw new ClientException(FailureKind.MALFORMED, "Unexpected DNS record shape: " + e.getMessage(), e);
        }
    }

    private URI uri(String path) throws ClientException {
        try {
            return URI.create(apiUrl + path);
        } catch (IllegalArgumentException e) {
            throw new ClientException(FailureKind.MALFORMED, "Invalid Cloudflare URL: " + apiUrl + path, e);
        }
    }

    private static Map<String, String> auth(String token) {
        return Map.of("Authorization", "Bearer " + token.trim());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
