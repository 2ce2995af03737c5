package com.koni.ems.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.ems.domain.model.DataPointStats;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregate statistics of a device, serialized with snake_case keys.
 */
@Getter
@AllArgsConstructor
public class DataPointStatsResponse {

    @JsonProperty("count")
    private final long count;

    @JsonProperty("first_timestamp")
    private final Instant firstTimestamp;

    @JsonProperty("last_timestamp")
    private final Instant lastTimestamp;

    @JsonProperty("avg_power")
    private final BigDecimal avgPower;

    @JsonProperty("max_power")
    private final BigDecimal maxPower;

    @JsonProperty("min_power")
    private final BigDecimal minPower;

    @JsonProperty("avg_power_factor")
    private final BigDecimal avgPowerFactor;

    @JsonProperty("avg_frequency")
    private final BigDecimal avgFrequency;

    public static DataPointStatsResponse from(DataPointStats stats) {
        return new DataPointStatsResponse(
                stats.getCount(),
                stats.getFirstTimestamp(),
                stats.getLastTimestamp(),
                stats.getAvgPower(),
                stats.getMaxPower(),
                stats.getMinPower(),
                stats.getAvgPowerFactor(),
                stats.getAvgFrequency()
        );
    }
}
