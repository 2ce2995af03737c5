package com.koni.ems.infrastructure.web.dto;

import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RegisterMapping;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Data Transfer Object representing a registered device.
 */
@Getter
@AllArgsConstructor
public class DeviceResponse {

    private final String id;
    private final String name;
    private final String type;
    private final String ipAddress;
    private final String subnetMask;
    private final int slaveAddress;
    private final DeviceStatus status;
    private final boolean includeInTotalSummary;
    private final List<RegisterMapping> registerMap;
    private final Instant lastSeen;

    public static DeviceResponse from(Device device) {
        return new DeviceResponse(
                device.getId(),
                device.getName(),
                device.getType(),
                device.getIpAddress(),
                device.getSubnetMask(),
                device.getSlaveAddress(),
                device.getStatus(),
                device.isIncludeInTotalSummary(),
                device.getRegisterMap(),
                device.getLastSeen()
        );
    }
}
