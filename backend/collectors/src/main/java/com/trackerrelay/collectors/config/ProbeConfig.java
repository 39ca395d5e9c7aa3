package com.trackerrelay.collectors.config;

import com.trackerrelay.core.model.ProbeResult;

import java.time.Duration;

public record ProbeConfig(
        Duration timeout,
        Duration scoreWindow,
        int topN,
        double minScore,
        String userAgent
) {
    public ProbeConfig {
        timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        scoreWindow = scoreWindow == null ? ProbeResult.DEFAULT_SCORE_WINDOW : scoreWindow;
        topN = topN <= 0 ? 4 : topN;
        minScore = minScore <= 0.0 ? 0.5 : minScore;
        userAgent = userAgent == null || userAgent.isBlank() ? "BitTorrent/2.0" : userAgent;
        if (minScore >= 1.0) {
            throw new IllegalArgumentException("minScore must be below 1.0, got: " + minScore);
        }
    }

    public static ProbeConfig defaults() {
        return new ProbeConfig(null, null, 0, 0.0, null);
    }
}
