package com.phillippitts.avifconverter.util;

import java.util.Locale;

/**
 * Time helpers for stage and conversion timing, based on {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Renders milliseconds as seconds with two decimals, e.g. {@code 1234 -> "1.23s"}.
     */
    public static String formatSeconds(long millis) {
        return String.format(Locale.ROOT, "%.2fs", millis / 1000.0);
    }
}
