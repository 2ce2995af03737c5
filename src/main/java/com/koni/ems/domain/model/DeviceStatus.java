package com.koni.ems.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.ems.domain.exception.ValidationException;

/**
 * Connection status reported for a device.
 */
public enum DeviceStatus {
    ONLINE, OFFLINE, CONNECTING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DeviceStatus fromWireName(String value) {
        for (DeviceStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Invalid status: " + value);
    }
}
