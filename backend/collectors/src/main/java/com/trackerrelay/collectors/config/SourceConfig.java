package com.trackerrelay.collectors.config;

import com.trackerrelay.core.util.RetryPolicy;

import java.time.Duration;
import java.util.List;

public record SourceConfig(
        List<String> urls,
        Duration requestTimeout,
        int maxAttempts,
        Duration retryBaseDelay
) {
    public static final List<String> DEFAULT_URLS = List.of(
            "https://raw.githubusercontent.com/XIU2/TrackersListCollection/master/all.txt",
            "https://raw.githubusercontent.com/ngosang/trackerslist/master/trackers_all.txt",
            "https://raw.githubusercontent.com/XIU2/TrackersListCollection/master/best.txt",
            "https://raw.githubusercontent.com/ngosang/trackerslist/master/trackers_best.txt",
            "https://raw.githubusercontent.com/DeSireFire/animeTrackerList/master/AT_best.txt",
            "https://raw.githubusercontent.com/BoxMiao007/Tracker-List/main/trackers.txt",
            "https://raw.githubusercontent.com/BoxMiao007/Tracker-List/main/trackers_best.txt",
            "http://github.itzmx.com/1265578519/OpenTracker/master/tracker.txt"
    );

    public SourceConfig {
        urls = urls == null || urls.isEmpty() ? DEFAULT_URLS : List.copyOf(urls);
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
        retryBaseDelay = retryBaseDelay == null ? Duration.ofSeconds(2) : retryBaseDelay;
    }

    public static SourceConfig defaults() {
        return new SourceConfig(null, null, 0, null);
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(maxAttempts, retryBaseDelay);
    }
}
