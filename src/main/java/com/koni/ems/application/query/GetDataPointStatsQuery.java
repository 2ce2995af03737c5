package com.koni.ems.application.query;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Query for power, power factor and frequency aggregates of one device.
 */
@Getter
@AllArgsConstructor
public class GetDataPointStatsQuery {

    private final Caller caller;
    private final String deviceId;
    private final Instant startTime;
    private final Instant endTime;
}
