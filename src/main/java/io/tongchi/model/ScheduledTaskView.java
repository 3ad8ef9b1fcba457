package io.tongchi.model;

import java.time.Instant;

public record ScheduledTaskView(
        String id,
        long intervalSeconds,
        boolean enabled,
        TaskState state,
        Instant lastRunAt,
        Instant lastSuccessAt,
        String lastError,
        Instant nextDueAt,
        long runCount,
        long failureCount
) {
}
