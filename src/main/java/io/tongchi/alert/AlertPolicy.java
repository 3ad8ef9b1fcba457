package io.tongchi.alert;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public record AlertPolicy(
        String source,
        String resourceKind,
        Set<String> failureStatuses,
        boolean alertOnRemoval
) {
    public static final Set<String> DEFAULT_FAILURE_STATUSES = Set.of("dead", "failed");

    public AlertPolicy {
        source = source == null || source.isBlank() ? "Tongchi" : source.trim();
        resourceKind = resourceKind == null || resourceKind.isBlank() ? "Resource" : resourceKind.trim();
        Set<String> normalized = new LinkedHashSet<>();
        Set<String> raw = failureStatuses == null || failureStatuses.isEmpty() ? DEFAULT_FAILURE_STATUSES : failureStatuses;
        for (String status : raw) {
            if (status != null && !status.isBlank()) {
                normalized.add(status.trim().toLowerCase(Locale.ROOT));
            }
        }
        failureStatuses = Set.copyOf(normalized);
    }

    public static AlertPolicy defaults(String source, String resourceKind) {
        return new AlertPolicy(source, resourceKind, DEFAULT_FAILURE_STATUSES, true);
    }

    public boolean isFailure(String status) {
        return status != null && failureStatuses.contains(status.trim().toLowerCase(Locale.ROOT));
    }

    public String title() {
        return source + " alert";
    }
}
