package com.phillippitts.voicelink.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time conversions used on the wire.
 *
 * <p>Protocol timestamps are whole epoch seconds; durations such as uptime are fractional
 * seconds.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one second.
     */
    public static final double NANOS_PER_SECOND = 1_000_000_000d;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts an instant to whole seconds since the epoch.
     *
     * @param instant point in time
     * @return epoch seconds (truncated)
     */
    public static long epochSeconds(Instant instant) {
        return instant.getEpochSecond();
    }

    /**
     * Fractional seconds elapsed between two instants; negative spans clamp to zero.
     *
     * @param from start instant
     * @param to end instant
     * @return elapsed seconds with nanosecond precision
     */
    public static double secondsBetween(Instant from, Instant to) {
        Duration d = Duration.between(from, to);
        if (d.isNegative()) {
            return 0d;
        }
        return d.getSeconds() + d.getNano() / NANOS_PER_SECOND;
    }
}
