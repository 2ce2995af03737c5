package com.koni.ems.application.query;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query to retrieve one registered device.
 */
@Getter
@AllArgsConstructor
public class GetDeviceQuery {

    private final Caller caller;
    private final String deviceId;
}
