package io.tongchi.model;

import io.tongchi.util.Durations;

import java.time.Duration;
import java.time.Instant;

public record ProcessView(
        String id,
        String name,
        String description,
        ProcessStatus status,
        Instant submittedAt,
        Instant startedAt,
        Instant finishedAt,
        boolean cancellable,
        boolean cancelRequested,
        int progress,
        Object result,
        String error
) {
    public Duration runtime(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = finishedAt != null ? finishedAt : now;
        return Duration.between(startedAt, end);
    }

    public String runtimeText(Instant now) {
        return Durations.humanize(runtime(now));
    }
}
