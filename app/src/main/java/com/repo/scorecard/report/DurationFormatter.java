package com.repo.scorecard.report;

import java.util.OptionalDouble;

/**
 * Renders millisecond durations as short human-readable strings.
 */
public final class DurationFormatter {

    public static final String ABSENT = "-";

    private DurationFormatter() {
    }

    public static String format(OptionalDouble millis) {
        return millis.isPresent() ? format((long) millis.getAsDouble()) : ABSENT;
    }

    /**
     * Two most significant units: "1d 4h", "3h 20m"; a single unit below an
     * hour: "45m", "30s".
     */
    public static String format(long millis) {
        long totalSeconds = Math.max(0, millis) / 1000;
        long days = totalSeconds / 86_400;
        long hours = (totalSeconds % 86_400) / 3_600;
        long minutes = (totalSeconds % 3_600) / 60;
        long seconds = totalSeconds % 60;

        if (days > 0) {
            return days + "d " + hours + "h";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m";
        }
        return seconds + "s";
    }
}
