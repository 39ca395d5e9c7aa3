package com.trackerrelay.service.publish;

// artifact is only set for a successful read.
public record ContentResponse(int status, RemoteArtifact artifact, RateLimit rateLimit, String body) {
    public boolean isSuccess() {
        return status / 100 == 2;
    }

    public boolean isThrottled() {
        return (status == 403 || status == 429) && rateLimit != null && rateLimit.nearlyExhausted();
    }
}
