package com.trackerrelay.core.model;

import java.util.Objects;

public record Failure(FailureKind kind, String target, String detail) {
    public Failure {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(target, "target is required");
        detail = detail == null ? "" : detail;
    }

    public static Failure of(FailureKind kind, String target, Throwable cause) {
        String text = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new Failure(kind, target, text);
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    @Override
    public String toString() {
        return kind + " " + target + (detail.isEmpty() ? "" : ": " + detail);
    }
}
