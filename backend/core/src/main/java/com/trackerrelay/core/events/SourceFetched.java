package com.trackerrelay.core.events;

import java.time.Instant;

public record SourceFetched(
        Instant timestamp,
        String url,
        boolean success,
        int trackerCount,
        String failureKind,
        String detail,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
