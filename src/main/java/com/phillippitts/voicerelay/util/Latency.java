package com.phillippitts.voicerelay.util;

import java.util.concurrent.TimeUnit;

/**
 * Turn latency arithmetic over {@link System#nanoTime()} readings.
 *
 * <p>Offsets within a turn (first text, first audio, apology start) are reported in whole
 * milliseconds from the turn's start reading. A reading taken before the start clamps to zero.
 */
public final class Latency {

    private Latency() {
    }

    /** Whole milliseconds from {@code startNanos} to {@code endNanos}, never negative. */
    public static long millisBetween(long startNanos, long endNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(endNanos - startNanos));
    }

    /** Whole milliseconds since {@code startNanos}, for call durations in logs and errors. */
    public static long millisSince(long startNanos) {
        return millisBetween(startNanos, System.nanoTime());
    }
}
