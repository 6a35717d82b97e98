package org.relaysync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.relaysync.client.ClientException.FailureKind;
import org.relaysync.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * JSON request/response over {@link HttpClient}. Every request carries its own timeout and every
 * failure, transport or HTTP status, surfaces as a {@link ClientException}.
 */
public class HttpJsonClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpJsonClient.class);
    private static final int MAX_ERROR_BODY = 300;

    private final ObjectMapper mapper = JsonUtil.mapper();
    private final Duration defaultTimeout;
    private final String userAgent;

    private final HttpClient client;

    public HttpJsonClient(Duration defaultTimeout, String userAgent) {
        this.defaultTimeout = defaultTimeout;
        this.userAgent = userAgent;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(defaultTimeout)
                .build();
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public JsonNode get(URI uri, Map<String, String> headers) throws ClientException {
        return send("GET", uri, headers, null, defaultTimeout);
    }

    public JsonNode post(URI uri, Map<String, String> headers, Object body) throws ClientException {
        return send("POST", uri, headers, body, defaultTimeout);
    }

    public JsonNode post(URI uri, Map<String, String> headers, Object body, Duration timeout) throws ClientException {
        return send("POST", uri, headers, body, timeout);
    }

    public JsonNode put(URI uri, Map<String, String> headers, Object body) throws ClientException {
        return send("PUT", uri, headers, body, defaultTimeout);
    }

    /**
     * @param body serialized as JSON; null sends no body
     * @return the parsed reply, {@code MissingNode} when the reply body is empty
     */
    public JsonNode send(String method, URI uri, Map<String, String> headers, Object body, Duration timeout)
            throws ClientException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder().uri(uri);
        } catch (IllegalArgumentException e) {
            throw new ClientException(FailureKind.MALFORMED, "Unsupported URL " + uri + ": " + e.getMessage(), e);
        }
        builder.timeout(timeout).header("Accept", "application/json");
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }
        if (headers != null) {
            headers.forEach(builder::header);
        }

        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json; charset=UTF-8");
            builder.method(method, HttpRequest.BodyPublishers.ofString(toJson(body), StandardCharsets.UTF_8));
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ClientException(FailureKind.TIMEOUT,
                    "Request to " + uri.getHost() + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ClientException(FailureKind.UNREACHABLE,
                    "Request to " + uri.getHost() + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException(FailureKind.UNREACHABLE, "Request to " + uri.getHost() + " was interrupted", e);
        }

        int status = response.statusCode();
        logger.debug("{} {} -> {}", method, uri.getPath(), status);
        if (status >= 400) {
            throw statusFailure(uri, status, response.body());
        }
        return parse(uri, status, response.body());
    }

    private String toJson(Object body) throws ClientException {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ClientException(FailureKind.MALFORMED, "Could not serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parse(URI uri, int status, String body) throws ClientException {
        if (body == null || body.isBlank()) {
            return mapper.missingNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ClientException(FailureKind.MALFORMED,
                    "Unparseable reply from " + uri.getHost() + ": " + abbreviate(body), status, e);
        }
    }

    private static ClientException statusFailure(URI uri, int status, String body) {
        String message = "HTTP " + status + " from " + uri.getHost() + uri.getPath()
                + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        FailureKind kind;
        if (status == 401 || status == 403) {
            kind = FailureKind.UNAUTHORIZED;
        } else if (status == 404) {
            kind = FailureKind.NOT_FOUND;
        } else if (status >= 500) {
            kind = FailureKind.UNREACHABLE;
        } else {
            kind = FailureKind.MALFORMED;
        }
        return new ClientException(kind, message, status, null);
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_ERROR_BODY ? flat : flat.substring(0, MAX_ERROR_BODY) + "...";
    }
}
