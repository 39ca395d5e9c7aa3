package com.trackerrelay.service.publish;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

public record RateLimit(long remaining, long resetEpochSeconds) {
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";
    private static final Duration MINIMUM_WAIT = Duration.ofSeconds(1);

    public static Optional<RateLimit> from(HttpHeaders headers) {
        OptionalLong remaining = parse(headers.firstValue(REMAINING_HEADER));
        if (remaining.isEmpty()) {
            return Optional.empty();
        }
        long reset = parse(headers.firstValue(RESET_HEADER)).orElse(0L);
        return Optional.of(new RateLimit(remaining.getAsLong(), reset));
    }

    public boolean nearlyExhausted() {
        return remaining <= 1;
    }

    public Instant resetAt() {
        return Instant.ofEpochSecond(resetEpochSeconds);
    }

    public Duration waitFrom(Instant now) {
        Duration untilReset = Duration.between(now, resetAt());
        return untilReset.compareTo(MINIMUM_WAIT) < 0 ? MINIMUM_WAIT : untilReset;
    }

    private static OptionalLong parse(Optional<String> raw) {
        if (raw.isEmpty() || raw.get().isBlank()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw.get().strip()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
