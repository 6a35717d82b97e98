package org.relaysync.client;

import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.HeaderValues;
import io.undertow.util.Headers;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Embedded Undertow standing in for a remote JSON API. Replies are canned per method and path;
 * every request is recorded.
 */
public class StubServer implements AutoCloseable {

    public record Recorded(String method, String path, String query, Map<String, String> headers, String body) {
        public String header(String name) {
            return headers.get(name.toLowerCase());
        }
    }

    private record Reply(int status, String body, long delayMillis) {}

    private final Map<String, List<Reply>> replies = new ConcurrentHashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final Undertow server;
    private boolean stopped;

    public StubServer() {
        server = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(new BlockingHandler(this::handle))
                .build();
        server.start();
    }

    public StubServer on(String method, String path, int status, String body) {
        return onDelayed(method, path, status, body, 0);
    }

    /**
     * Queues a reply; the last queued reply for a route is repeated once the others are used up.
     */
    public StubServer onDelayed(String method, String path, int status, String body, long delayMillis) {
        replies.computeIfAbsent(method + " " + path, k -> new CopyOnWriteArrayList<>())
                .add(new Reply(status, body, delayMillis));
        return this;
    }

    public String baseUrl() {
        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return "http://127.0.0.1:" + address.getPort();
    }

    public List<Recorded> requests() {
        return requests;
    }

    public List<Recorded> requests(String method, String path) {
        return requests.stream().filter(r -> r.method().equals(method) && r.path().equals(path)).toList();
    }

    private void handle(HttpServerExchange exchange) throws Exception {
        String body;
        try (InputStream in = exchange.getInputStream()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Map<String, String> headers = new TreeMap<>();
        for (HeaderValues values : exchange.getRequestHeaders()) {
            headers.put(values.getHeaderName().toString().toLowerCase(), values.getFirst());
        }
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();
        requests.add(new Recorded(method, path, exchange.getQueryString(), headers, body));

        List<Reply> queue = replies.get(method + " " + path);
        if (queue == null || queue.isEmpty()) {
            exchange.setStatusCode(404);
            exchange.getResponseSender().send("{\"error\":\"no stub for " + method + " " + path + "\"}");
            return;
        }
        Reply reply = queue.size() > 1 ? queue.remove(0) : queue.get(0);
        if (reply.delayMillis() > 0) {
            Thread.sleep(reply.delayMillis());
        }
        exchange.setStatusCode(reply.status());
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(reply.body() == null ? "" : reply.body());
    }

    @Override
    public synchronized void close() {
        if (!stopped) {
            stopped = true;
            server.stop();
        }
    }
}
