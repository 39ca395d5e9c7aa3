package com.trackerrelay.service.publish;

import java.util.Objects;

public record RemoteArtifact(String path, String content, String sha) {
    public RemoteArtifact {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(sha, "sha is required");
    }

    public boolean sameContentAs(String candidate) {
        return content.strip().equals(candidate.strip());
    }
}
