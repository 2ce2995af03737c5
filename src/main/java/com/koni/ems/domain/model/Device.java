package com.koni.ems.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A metering device as recorded in the device registry.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class Device {

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

    public RelationName relationName() {
        return RelationName.forDevice(id);
    }

    /**
     * Finds the register map entry for a parameter.
     */
    public Optional<RegisterMapping> mappingFor(String parameter) {
        if (registerMap == null) {
            return Optional.empty();
        }
        return registerMap.stream()
                .filter(mapping -> mapping.getParameter().equals(parameter))
                .findFirst();
    }
}
