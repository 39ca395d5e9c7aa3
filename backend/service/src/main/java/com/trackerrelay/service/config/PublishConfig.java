package com.trackerrelay.service.config;

import com.trackerrelay.core.util.RetryPolicy;

import java.time.Duration;

public record PublishConfig(
        String apiUrl,
        String owner,
        String repo,
        String token,
        String primaryPath,
        String bestPath,
        String readmePath,
        Boolean publishReadme,
        Duration requestTimeout,
        int maxAttempts,
        Duration retryBaseDelay
) {
    public PublishConfig {
        apiUrl = blankToDefault(apiUrl, "https://api.github.com");
        while (apiUrl.endsWith("/")) {
            apiUrl = apiUrl.substring(0, apiUrl.length() - 1);
        }
        owner = blankToDefault(owner, "BoxMiao007");
        repo = blankToDefault(repo, "Tracker-List");
        token = token == null ? "" : token.strip();
        primaryPath = blankToDefault(primaryPath, "trackers.txt");
        bestPath = blankToDefault(bestPath, "trackers_best.txt");
        readmePath = blankToDefault(readmePath, "README.md");
        publishReadme = publishReadme == null ? Boolean.TRUE : publishReadme;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
        retryBaseDelay = retryBaseDelay == null ? Duration.ofSeconds(2) : retryBaseDelay;
    }

    public static PublishConfig defaults() {
        return new PublishConfig(null, null, null, null, null, null, null, null, null, 0, null);
    }

    public PublishConfig withRepository(String apiUrl, String owner, String repo, String token) {
        return new PublishConfig(apiUrl, owner, repo, token, primaryPath, bestPath, readmePath,
                publishReadme, requestTimeout, maxAttempts, retryBaseDelay);
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(maxAttempts, retryBaseDelay);
    }

    public boolean hasToken() {
        return !token.isEmpty();
    }

    @Override
    public String toString() {
        return "PublishConfig[apiUrl=" + apiUrl + ", repository=" + owner + "/" + repo
                + ", token=" + (hasToken() ? "***" : "<unset>")
                + ", primaryPath=" + primaryPath + ", bestPath=" + bestPath + ", readmePath=" + readmePath
                + ", publishReadme=" + publishReadme + ", requestTimeout=" + requestTimeout
                + ", maxAttempts=" + maxAttempts + ", retryBaseDelay=" + retryBaseDelay + "]";
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.strip();
    }
}
