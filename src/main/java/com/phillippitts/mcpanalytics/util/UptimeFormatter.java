package com.phillippitts.mcpanalytics.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Formats elapsed service time for the analytics summary.
 *
 * <p>Output starts at the coarsest non-zero unit:
 * <pre>
 * 3d 4h 12m
 * 4h 12m
 * 12m
 * </pre>
 *
 * @since 1.0
 */
public final class UptimeFormatter {

    private UptimeFormatter() {
        // Utility class - prevent instantiation
    }

    /**
     * Formats the time between {@code start} and {@code now}.
     *
     * <p>A start time in the future (clock moved backwards) formats as {@code 0m}.
     *
     * @param start server start time
     * @param now   current time
     * @return uptime string such as {@code 2h 5m}
     */
    public static String format(Instant start, Instant now) {
        Duration elapsed = Duration.between(start, now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        return format(elapsed);
    }

    /**
     * Formats a duration, truncated to whole minutes.
     *
     * @param elapsed non-negative duration
     * @return uptime string such as {@code 1d 0h 3m}
     */
    public static String format(Duration elapsed) {
        long days = elapsed.toDays();
        int hours = elapsed.toHoursPart();
        int minutes = elapsed.toMinutesPart();

        if (days > 0) {
            return days + "d " + hours + "h " + minutes + "m";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        return minutes + "m";
    }
}
