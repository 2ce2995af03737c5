package com.koni.ems.application.command;

import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RegisterMapping;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Command to register a device, or to replace the attributes of a registered one.
 * Attributes left {@code null} take the defaults of the device type.
 */
@Getter
@AllArgsConstructor
public class RegisterDeviceCommand {

    private final Caller caller;
    private final String deviceId;
    private final String name;
    private final String type;
    private final String ipAddress;
    private final String subnetMask;
    private final Integer slaveAddress;
    private final DeviceStatus status;
    private final Boolean includeInTotalSummary;
    private final List<RegisterMapping> registerMap;
}
