package com.koni.ems.application.query;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for the newest row of one device.
 */
@Getter
@AllArgsConstructor
public class GetLatestDataPointQuery {

    private final Caller caller;
    private final String deviceId;
}
