package com.trackerrelay.core.events;

import java.time.Instant;

public record StageStarted(Instant timestamp, String stage, int tasks) implements Event {
    @Override
    public String type() {
        return "StageStarted";
    }
}
