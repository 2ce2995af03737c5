package com.koni.ems.application.command;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to remove a device together with its stored data.
 */
@Getter
@AllArgsConstructor
public class DeleteDeviceCommand {

    private final Caller caller;
    private final String deviceId;
}
