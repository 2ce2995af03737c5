package com.koni.ems.application.query;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Query for the rows of one device inside an optional time window, newest first.
 * Unset paging parameters take the configured defaults.
 */
@Getter
@AllArgsConstructor
public class GetDataPointsQuery {

    private final Caller caller;
    private final String deviceId;
    private final Instant startTime;
    private final Instant endTime;
    private final Integer limit;
    private final Integer offset;
}
