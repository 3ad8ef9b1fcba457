package io.tongchi.model;

public enum ProcessStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static ProcessStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (ProcessStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown process status: " + raw);
    }
}
