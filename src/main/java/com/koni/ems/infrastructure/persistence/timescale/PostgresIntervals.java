package com.koni.ems.infrastructure.persistence.timescale;

import java.time.Duration;

/**
 * Renders durations as PostgreSQL interval literals.
 */
final class PostgresIntervals {

    private PostgresIntervals() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws IllegalArgumentException if the duration is not positive
     */
    static String toInterval(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + duration);
        }
        return duration.getSeconds() + " seconds";
    }
}
