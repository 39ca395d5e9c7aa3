package com.trackerrelay.collectors.probe;

import com.trackerrelay.collectors.api.HttpCalls;
import com.trackerrelay.collectors.config.ProbeConfig;
import com.trackerrelay.core.model.ProbeResult;
import com.trackerrelay.core.model.TrackerScheme;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HttpTrackerProbe implements TrackerProbe {
    private static final Logger LOGGER = Logger.getLogger(HttpTrackerProbe.class.getName());

    private final HttpClient httpClient;
    private final ProbeConfig config;

    public HttpTrackerProbe(HttpClient httpClient, ProbeConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public boolean supports(TrackerScheme scheme) {
        return scheme.isHttp();
    }

    @Override
    public ProbeResult probe(String endpoint) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(announceUrl(endpoint)))
                    .GET()
                    .timeout(config.timeout())
                    .header("User-Agent", config.userAgent())
                    .build();
        } catch (IllegalArgumentException e) {
            LOGGER.fine("Skipping malformed HTTP tracker " + endpoint + ": " + e.getMessage());
            return ProbeResult.dead(endpoint, Duration.ZERO);
        }

        long startedAt = System.nanoTime();
        try {
            HttpResponse<Void> response = HttpCalls.send(httpClient, request,
                    HttpResponse.BodyHandlers.discarding(), config.timeout());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            boolean alive = response.statusCode() >= 200 && response.statusCode() < 300;
            return ProbeResult.measured(endpoint, alive, elapsed, config.scoreWindow());
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "HTTP probe failed for " + endpoint, e);
            return ProbeResult.dead(endpoint, config.timeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.dead(endpoint, config.timeout());
        }
    }

    static String announceUrl(String endpoint) {
        int end = endpoint.length();
        while (end > 0 && endpoint.charAt(end - 1) == '/') {
            end--;
        }
        return endpoint.substring(0, end) + "/announce";
    }
}
