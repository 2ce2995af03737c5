package com.koni.ems.application.command;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Command to store one reading of a device.
 * The payload is the decoded request body and is validated by the handler.
 */
@Getter
@AllArgsConstructor
public class IngestDataPointCommand {

    private final Caller caller;
    private final String deviceId;

    /**
     * Optional {@code timestamp} plus measurement values keyed by canonical field name.
     */
    private final Map<String, Object> payload;
}
