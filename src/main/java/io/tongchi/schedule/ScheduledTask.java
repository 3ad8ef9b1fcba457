package io.tongchi.schedule;

public record ScheduledTask(
        String id,
        long intervalSeconds,
        boolean enabled
) {
    public ScheduledTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("scheduled task id cannot be empty");
        }
        if (intervalSeconds <= 0L) {
            throw new IllegalArgumentException("scheduled task interval must be positive: " + id);
        }
    }

    public static ScheduledTask every(String id, long intervalSeconds) {
        return new ScheduledTask(id, intervalSeconds, true);
    }
}
