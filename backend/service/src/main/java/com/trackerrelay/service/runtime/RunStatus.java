package com.trackerrelay.service.runtime;

public enum RunStatus {
    COMPLETED(0),
    PRIMARY_PUBLISH_FAILED(1),
    BELOW_SAFETY_FLOOR(2);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
