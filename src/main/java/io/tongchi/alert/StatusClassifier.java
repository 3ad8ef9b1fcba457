package io.tongchi.alert;

import java.util.List;
import java.util.Locale;

public final class StatusClassifier {
    private static final List<String> FAILED_WORDS = List.of(
            "unhealthy", "failed", "error", "critical", "dead", "stopped", "down");
    private static final List<String> HEALTHY_WORDS = List.of(
            "healthy", "running", "active", "passing", "ok", "success", "applied", "complete");
    private static final List<String> PENDING_WORDS = List.of("pending", "starting", "queued", "planning");
    private static final List<String> WARNING_WORDS = List.of("warning", "degraded");

    private StatusClassifier() {
    }

    public enum Category {
        HEALTHY("🟢"),
        FAILED("🔴"),
        PENDING("🟡"),
        WARNING("🟠"),
        UNKNOWN("⚪");

        private final String marker;

        Category(String marker) {
            this.marker = marker;
        }

        public String marker() {
            return marker;
        }
    }

    // Failure words are checked first so "unhealthy" never matches "healthy".
    public static Category classify(String status) {
        if (status == null || status.isBlank()) {
            return Category.UNKNOWN;
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        if (containsAny(normalized, FAILED_WORDS)) {
            return Category.FAILED;
        }
        if (containsAny(normalized, HEALTHY_WORDS)) {
            return Category.HEALTHY;
        }
        if (containsAny(normalized, PENDING_WORDS)) {
            return Category.PENDING;
        }
        if (containsAny(normalized, WARNING_WORDS)) {
            return Category.WARNING;
        }
        return Category.UNKNOWN;
    }

    public static String label(String status, String text) {
        return classify(status).marker() + " " + (text == null ? "" : text);
    }

    private static boolean containsAny(String value, List<String> words) {
        for (String word : words) {
            if (value.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
