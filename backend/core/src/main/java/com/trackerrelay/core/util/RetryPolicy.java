package com.trackerrelay.core.util;

import java.time.Duration;
import java.util.Objects;

// Attempt n (zero based) is followed by baseDelay * 2^n, except after the last one.
public final class RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;

    private RetryPolicy(int maxAttempts, Duration baseDelay) {
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be greater than 0, got: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative, got: " + baseDelay);
        }
        return new RetryPolicy(maxAttempts, baseDelay);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration delayAfter(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative, got: " + attempt);
        }
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts - 1;
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + "]";
    }
}
