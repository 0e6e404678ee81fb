package com.phillippitts.videoconverter.util;

import java.time.Duration;

/**
 * Utility methods for elapsed-time calculations and delay arithmetic.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns {@code base * 2^exponent}, saturating at {@code cap}.
     *
     * @param base starting delay
     * @param exponent number of doublings, negative values are treated as zero
     * @param cap upper bound (must not be null)
     */
    public static Duration doubled(Duration base, int exponent, Duration cap) {
        Duration result = base;
        for (int i = 0; i < Math.max(0, exponent); i++) {
            result = result.multipliedBy(2);
            if (result.compareTo(cap) >= 0) {
                return cap;
            }
        }
        return result.compareTo(cap) > 0 ? cap : result;
    }
}
