package com.trackerrelay.core.events;

import java.time.Instant;

public record StageCompleted(
        Instant timestamp,
        String stage,
        boolean success,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "StageCompleted";
    }
}
