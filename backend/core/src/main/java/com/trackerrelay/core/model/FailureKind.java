package com.trackerrelay.core.model;

public enum FailureKind {
    TIMEOUT(true),
    CONNECTION(true),
    REMOTE_STATUS(true),
    HTTP_STATUS(false),
    RETRIES_EXHAUSTED(false),
    FORBIDDEN(false),
    MISSING_VERSION(false),
    MALFORMED_ENDPOINT(false),
    INTERRUPTED(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
