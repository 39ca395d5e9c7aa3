package com.trackerrelay.service.publish;

import com.trackerrelay.core.model.Failure;

import java.util.Objects;

public record PublishOutcome(String path, PublishStatus status, Failure failure) {
    public PublishOutcome {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(status, "status is required");
        if ((status == PublishStatus.FAILED) != (failure != null)) {
            throw new IllegalArgumentException("failure must be present exactly when status is FAILED");
        }
    }

    public static PublishOutcome updated(String path) {
        return new PublishOutcome(path, PublishStatus.UPDATED, null);
    }

    public static PublishOutcome skipped(String path) {
        return new PublishOutcome(path, PublishStatus.SKIPPED, null);
    }

    public static PublishOutcome failed(Failure failure) {
        return new PublishOutcome(failure.target(), PublishStatus.FAILED, failure);
    }

    public boolean succeeded() {
        return status != PublishStatus.FAILED;
    }
}
