package io.tongchi.util;

import java.time.Duration;

public final class Durations {
    private Durations() {
    }

    public static String humanize(Duration duration) {
        long seconds = duration == null || duration.isNegative() ? 0L : duration.getSeconds();
        if (seconds < 60L) {
            return seconds + "s";
        }
        if (seconds < 3_600L) {
            return (seconds / 60L) + "m " + (seconds % 60L) + "s";
        }
        return (seconds / 3_600L) + "h " + ((seconds % 3_600L) / 60L) + "m";
    }
}
