package com.trackerrelay.collectors.api;

import com.trackerrelay.core.model.Failure;

import java.util.Objects;

public record FetchResult(String url, String body, Failure failure) {
    public FetchResult {
        Objects.requireNonNull(url, "url is required");
        if ((body == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of body or failure must be present");
        }
    }

    public static FetchResult succeeded(String url, String body) {
        return new FetchResult(url, body, null);
    }

    public static FetchResult failed(Failure failure) {
        return new FetchResult(failure.target(), null, failure);
    }

    public boolean success() {
        return failure == null;
    }
}
