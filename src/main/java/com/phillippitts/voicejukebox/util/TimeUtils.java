package com.phillippitts.voicejukebox.util;

/**
 * Utility methods for elapsed-time and deadline arithmetic based on {@link System#nanoTime()}.
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
     * Converts a timeout into a deadline on the {@link System#nanoTime()} clock.
     *
     * @param timeoutMs timeout in milliseconds
     * @return deadline in nanoseconds
     */
    public static long deadlineAfter(long timeoutMs) {
        return System.nanoTime() + timeoutMs * NANOS_PER_MILLI;
    }

    /**
     * Milliseconds left until a deadline, never negative.
     *
     * @param deadlineNanos deadline from {@link #deadlineAfter(long)}
     * @return remaining milliseconds, or 0 once the deadline has passed
     */
    public static long remainingMillis(long deadlineNanos) {
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI);
    }
}
