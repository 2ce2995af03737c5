package com.koni.ems.domain.model;

import com.koni.ems.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;

/**
 * Optional time bounds of a query. Both bounds are inclusive; a missing bound is open.
 */
@Getter
@EqualsAndHashCode
public final class TimeWindow {

    private static final TimeWindow UNBOUNDED = new TimeWindow(null, null);

    private final Instant start;
    private final Instant end;

    private TimeWindow(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @throws ValidationException if both bounds are set and start is after end
     */
    public static TimeWindow of(Instant start, Instant end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new ValidationException("startTime must not be after endTime");
        }
        if (start == null && end == null) {
            return UNBOUNDED;
        }
        return new TimeWindow(start, end);
    }

    public static TimeWindow unbounded() {
        return UNBOUNDED;
    }

    @Override
    public String toString() {
        return "[" + (start == null ? "-inf" : start) + ", " + (end == null ? "+inf" : end) + "]";
    }
}
