package com.koni.ems.application.command;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Command to store a frame of raw holding-register words read from a device.
 */
@Getter
@AllArgsConstructor
public class IngestRegisterFrameCommand {

    private final Caller caller;
    private final String deviceId;

    /**
     * Time the registers were read, or {@code null} for insertion time.
     */
    private final Instant timestamp;

    /**
     * Register words keyed by the parameter name of the device register map.
     */
    private final Map<String, int[]> registers;
}
