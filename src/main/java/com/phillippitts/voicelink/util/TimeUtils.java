package com.phillippitts.voicelink.util;

/**
 * Time conversions for {@link System#nanoTime()} based measurements.
 *
 * <p>API responses report durations as fractional seconds while logs and metrics use
 * milliseconds, so both views are provided here.
 */
public final class TimeUtils {

    /** Number of nanoseconds in one millisecond. */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
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
     * Calculates elapsed seconds since a nanosecond timestamp, keeping sub-second precision.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed seconds as a double
     */
    public static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_SECOND;
    }
}
