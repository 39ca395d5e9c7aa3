package com.trackerrelay.service.publish;

public enum PublishStatus {
    UPDATED,
    SKIPPED,
    FAILED
}
