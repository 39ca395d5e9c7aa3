package com.trackerrelay.core.model;

import java.util.Objects;

public record SourceOutcome(String url, boolean success, int trackerCount, Failure failure) {
    public SourceOutcome {
        Objects.requireNonNull(url, "url is required");
        if (success == (failure != null)) {
            throw new IllegalArgumentException("failure must be present exactly when the fetch failed");
        }
    }

    public static SourceOutcome succeeded(String url, int trackerCount) {
        return new SourceOutcome(url, true, trackerCount, null);
    }

    public static SourceOutcome failed(String url, Failure failure) {
        return new SourceOutcome(url, false, 0, failure);
    }
}
