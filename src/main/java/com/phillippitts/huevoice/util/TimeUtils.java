package com.phillippitts.huevoice.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Time helpers shared by the pipeline stages.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a spoken amount and unit ("second", "minute", "hour", optionally plural) to a duration.
     *
     * @throws IllegalArgumentException for an unknown unit or a negative amount
     */
    public static Duration spokenDuration(long amount, String unit) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got: " + amount);
        }
        String normalized = unit.toLowerCase(Locale.ROOT);
        if (normalized.endsWith("s")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return switch (normalized) {
            case "second" -> Duration.of(amount, ChronoUnit.SECONDS);
            case "minute" -> Duration.of(amount, ChronoUnit.MINUTES);
            case "hour" -> Duration.of(amount, ChronoUnit.HOURS);
            default -> throw new IllegalArgumentException("Unknown time unit: " + unit);
        };
    }
}
