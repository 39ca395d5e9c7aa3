package com.trackerrelay.core.events;

import java.time.Instant;

public record ProbeCompleted(
        Instant timestamp,
        int probed,
        int alive,
        int selected,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "ProbeCompleted";
    }
}
