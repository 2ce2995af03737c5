package com.koni.ems.domain.exception;

import lombok.Getter;

/**
 * Exception thrown when a device identifier maps to the same storage relation
 * as a different, already registered device identifier.
 */
@Getter
public class RelationNameCollisionException extends RuntimeException {
    
    private final String deviceId;
    private final String existingDeviceId;
    private final String relationName;
    
    public RelationNameCollisionException(String deviceId, String existingDeviceId, String relationName) {
        super("Device id '" + deviceId + "' maps to relation " + relationName
                + " which already belongs to device '" + existingDeviceId + "'");
        this.deviceId = deviceId;
        this.existingDeviceId = existingDeviceId;
        this.relationName = relationName;
    }
}
