package io.tongchi.model;

import java.time.Instant;

public record Alert(
        String resourceId,
        Kind kind,
        String title,
        String message,
        String previousStatus,
        String currentStatus,
        Instant raisedAt
) {
    public enum Kind {
        FAILED,
        REMOVED
    }
}
