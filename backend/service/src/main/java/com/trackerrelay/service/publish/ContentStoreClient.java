package com.trackerrelay.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.trackerrelay.collectors.api.HttpCalls;
import com.trackerrelay.core.util.JsonUtils;
import com.trackerrelay.service.config.PublishConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

public class ContentStoreClient {
    static final String ACCEPT = "application/vnd.github+json";
    static final String USER_AGENT = "tracker-relay";

    private final HttpClient httpClient;
    private final PublishConfig config;

    public ContentStoreClient(HttpClient httpClient, PublishConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    public ContentResponse get(String path) throws IOException, InterruptedException {
        HttpRequest request = baseRequest(path).GET().build();
        HttpResponse<String> response = HttpCalls.send(httpClient, request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), config.requestTimeout());
        RateLimit rateLimit = RateLimit.from(response.headers()).orElse(null);
        RemoteArtifact artifact = response.statusCode() == 200 ? parseArtifact(path, response.body()) : null;
        return new ContentResponse(response.statusCode(), artifact, rateLimit, response.body());
    }

    public ContentResponse put(String path, String content, String message, String sha)
            throws IOException, InterruptedException {
        String payload = JsonUtils.toJson(new WriteRequest(message, encode(content), sha));
        HttpRequest request = baseRequest(path)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = HttpCalls.send(httpClient, request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), config.requestTimeout());
        RateLimit rateLimit = RateLimit.from(response.headers()).orElse(null);
        return new ContentResponse(response.statusCode(), null, rateLimit, response.body());
    }

    URI contentsUri(String path) {
        StringBuilder encodedPath = new StringBuilder();
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (encodedPath.length() > 0) {
                encodedPath.append('/');
            }
            encodedPath.append(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return URI.create(config.apiUrl() + "/repos/" + config.owner() + "/" + config.repo() + "/contents/" + encodedPath);
    }

    static String encode(String content) {
        return Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
    }

    static String decode(String encoded) {
        return new String(Base64.getMimeDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    private HttpRequest.Builder baseRequest(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(contentsUri(path))
                .timeout(config.requestTimeout())
                .header("Accept", ACCEPT)
                .header("User-Agent", USER_AGENT);
        if (config.hasToken()) {
            builder.header("Authorization", "Bearer " + config.token());
        }
        return builder;
    }

    private static RemoteArtifact parseArtifact(String path, String body) throws IOException {
        JsonNode node;
        try {
            node = JsonUtils.readTree(body);
        } catch (IllegalStateException e) {
            throw new IOException("Malformed contents response for " + path, e);
        }
        String sha = node.path("sha").asText("");
        if (sha.isEmpty() || !node.path("content").isTextual()) {
            throw new IOException("Contents response for " + path + " lacks sha or content");
        }
        try {
            return new RemoteArtifact(path, decode(node.path("content").asText()), sha);
        } catch (IllegalArgumentException e) {
            throw new IOException("Contents response for " + path + " is not valid base64", e);
        }
    }

    private record WriteRequest(String message, String content, String sha) {
    }
}
