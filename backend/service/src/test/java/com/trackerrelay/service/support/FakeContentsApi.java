package com.trackerrelay.service.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.trackerrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

// Single-repository contents API; every write changes the sha, a stale sha gets 409.
public class FakeContentsApi implements AutoCloseable {
    public static final String OWNER = "owner";
    public static final String REPO = "repo";
    private static final String PREFIX = "/repos/" + OWNER + "/" + REPO + "/contents/";

    public record Recorded(String method, String path, JsonNode body, String authorization, Instant at) {
    }

    public record Scripted(int status, String body, Map<String, String> headers) {
        public static Scripted status(int status) {
            return new Scripted(status, "{\"message\":\"scripted\"}", Map.of());
        }

        public static Scripted throttled(long remaining, Instant reset) {
            return new Scripted(403, "{\"message\":\"API rate limit exceeded\"}", Map.of(
                    "X-RateLimit-Remaining", Long.toString(remaining),
                    "X-RateLimit-Reset", Long.toString(reset.getEpochSecond())
            ));
        }
    }

    private record StoredFile(String content, String sha) {
    }

    private final HttpServer server;
    private final Clock clock;
    private final Map<String, StoredFile> files = new ConcurrentHashMap<>();
    private final Map<String, Deque<Scripted>> scripted = new ConcurrentHashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger versions = new AtomicInteger();
    private volatile Map<String, String> defaultHeaders = Map.of();

    public FakeContentsApi(Clock clock) throws IOException {
        this.clock = clock;
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/repos/", this::handle);
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public void seed(String path, String content, String sha) {
        files.put(path, new StoredFile(content, sha));
    }

    public Optional<String> content(String path) {
        return Optional.ofNullable(files.get(path)).map(StoredFile::content);
    }

    public Optional<String> sha(String path) {
        return Optional.ofNullable(files.get(path)).map(StoredFile::sha);
    }

    public void script(String method, String path, Scripted... responses) {
        Deque<Scripted> queue = scripted.computeIfAbsent(method + " " + path, ignored -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addAll(List.of(responses));
        }
    }

    public void defaultHeaders(Map<String, String> headers) {
        this.defaultHeaders = Map.copyOf(headers);
    }

    public List<Recorded> requests() {
        return List.copyOf(requests);
    }

    public List<Recorded> requests(String method, String path) {
        return requests.stream().filter(r -> r.method().equals(method) && r.path().equals(path)).toList();
    }

    public long writes() {
        return requests.stream().filter(r -> r.method().equals("PUT")).count();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String rawPath = exchange.getRequestURI().getRawPath();
        if (!rawPath.startsWith(PREFIX)) {
            respond(exchange, new Scripted(404, "{\"message\":\"Not Found\"}", Map.of()));
            return;
        }
        String path = URLDecoder.decode(rawPath.substring(PREFIX.length()), StandardCharsets.UTF_8);
        String method = exchange.getRequestMethod();
        byte[] requestBody = exchange.getRequestBody().readAllBytes();
        JsonNode body = requestBody.length == 0 ? null : JsonUtils.readTree(new String(requestBody, StandardCharsets.UTF_8));
        requests.add(new Recorded(method, path, body, exchange.getRequestHeaders().getFirst("Authorization"), clock.instant()));

        Scripted next = nextScripted(method + " " + path);
        if (next != null) {
            respond(exchange, next);
            return;
        }
        if (method.equals("GET")) {
            respond(exchange, read(path));
        } else if (method.equals("PUT")) {
            respond(exchange, write(path, body));
        } else {
            respond(exchange, new Scripted(405, "{}", defaultHeaders));
        }
    }

    private Scripted nextScripted(String key) {
        Deque<Scripted> queue = scripted.get(key);
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    private Scripted read(String path) {
        StoredFile file = files.get(path);
        if (file == null) {
            return new Scripted(404, "{\"message\":\"Not Found\"}", defaultHeaders);
        }
        String encoded = Base64.getMimeEncoder().encodeToString(file.content().getBytes(StandardCharsets.UTF_8));
        String json = JsonUtils.toJson(Map.of("path", path, "sha", file.sha(), "encoding", "base64", "content", encoded));
        return new Scripted(200, json, defaultHeaders);
    }

    private synchronized Scripted write(String path, JsonNode body) {
        StoredFile current = files.get(path);
        String sha = body.hasNonNull("sha") ? body.get("sha").asText() : null;
        if (current != null && !current.sha().equals(sha)) {
            return new Scripted(409, "{\"message\":\"sha does not match\"}", defaultHeaders);
        }
        if (current == null && sha != null) {
            return new Scripted(422, "{\"message\":\"sha for a missing file\"}", defaultHeaders);
        }
        String content = new String(Base64.getDecoder().decode(body.get("content").asText()), StandardCharsets.UTF_8);
        String nextSha = "sha-" + versions.incrementAndGet();
        files.put(path, new StoredFile(content, nextSha));
        String json = JsonUtils.toJson(Map.of("content", Map.of("path", path, "sha", nextSha)));
        return new Scripted(current == null ? 201 : 200, json, defaultHeaders);
    }

    private static void respond(HttpExchange exchange, Scripted response) throws IOException {
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        response.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
