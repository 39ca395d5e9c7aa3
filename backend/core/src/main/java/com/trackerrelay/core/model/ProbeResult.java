package com.trackerrelay.core.model;

import java.time.Duration;
import java.util.Objects;

public record ProbeResult(String endpoint, boolean alive, Duration latency, double score) {
    public static final Duration DEFAULT_SCORE_WINDOW = Duration.ofSeconds(5);

    public ProbeResult {
        Objects.requireNonNull(endpoint, "endpoint is required");
        Objects.requireNonNull(latency, "latency is required");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1], got: " + score);
        }
        if (!alive && score != 0.0) {
            throw new IllegalArgumentException("dead endpoint must score 0, got: " + score);
        }
    }

    public static ProbeResult measured(String endpoint, boolean alive, Duration latency, Duration scoreWindow) {
        return new ProbeResult(endpoint, alive, latency, score(alive, latency, scoreWindow));
    }

    public static ProbeResult dead(String endpoint, Duration latency) {
        return new ProbeResult(endpoint, false, latency, 0.0);
    }

    static double score(boolean alive, Duration latency, Duration scoreWindow) {
        if (!alive || scoreWindow.isZero() || scoreWindow.isNegative()) {
            return 0.0;
        }
        double ratio = (double) Math.max(0L, latency.toNanos()) / scoreWindow.toNanos();
        return Math.max(0.0, 1.0 - ratio);
    }
}
