package com.phillippitts.commandrouter.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds left of a budget that started at {@code startNanos}; never negative.
     */
    public static long remainingMillis(long startNanos, long budgetMs) {
        return Math.max(0L, budgetMs - elapsedMillis(startNanos));
    }
}
