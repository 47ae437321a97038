package com.phillippitts.talkback.util;

/**
 * Conversions for {@link System#nanoTime()} based timing.
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
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Nanoseconds elapsed since {@code startNanos}.
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    /**
     * Milliseconds elapsed since {@code startNanos}.
     *
     * <pre>
     * long start = System.nanoTime();
     * // ... do work ...
     * long elapsedMs = TimeUtils.elapsedMillis(start);
     * </pre>
     */
    public static long elapsedMillis(long startNanos) {
        return elapsedNanos(startNanos) / NANOS_PER_MILLI;
    }
}
