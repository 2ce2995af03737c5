package com.koni.ems.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregate statistics over a device relation, computed by a single SQL aggregate.
 * All values except {@code count} are {@code null} when the window holds no rows
 * (or no row reports the underlying column).
 */
@Getter
@AllArgsConstructor
@ToString
public final class DataPointStats {

    private final long count;
    private final Instant firstTimestamp;
    private final Instant lastTimestamp;
    private final BigDecimal avgPower;
    private final BigDecimal maxPower;
    private final BigDecimal minPower;
    private final BigDecimal avgPowerFactor;
    private final BigDecimal avgFrequency;
}
