package com.trackerrelay.core.events;

import java.time.Instant;

public record ArtifactPublished(
        Instant timestamp,
        String path,
        String status,
        String failureKind,
        String detail
) implements Event {
    @Override
    public String type() {
        return "ArtifactPublished";
    }
}
