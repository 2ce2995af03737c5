package com.koni.ems.application.command;

import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DeviceStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to record the connection status reported for a device.
 */
@Getter
@AllArgsConstructor
public class UpdateDeviceStatusCommand {

    private final Caller caller;
    private final String deviceId;
    private final DeviceStatus status;
}
