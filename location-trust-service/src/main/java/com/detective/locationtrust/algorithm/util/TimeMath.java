package com.detective.locationtrust.algorithm.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Elapsed-time helpers for fix timestamps. Timestamps come from devices and may sit anywhere in
 * the {@link Instant} range, so nothing here goes through a millisecond or nanosecond count.
 */
public final class TimeMath {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeMath() {}

    /** Signed seconds from {@code from} to {@code to}; negative when {@code to} is earlier. */
    public static double secondsBetween(Instant from, Instant to) {
        return toSeconds(Duration.between(from, to));
    }

    public static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
    }
}
