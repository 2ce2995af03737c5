package com.koni.ems.application.command;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.repository.DeviceRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Command handler for status reports of the device poller.
 * Every report also marks the device as seen now.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpdateDeviceStatusCommandHandler {

    private final DeviceAccessGuard accessGuard;
    private final DeviceRepository deviceRepository;

    /**
     * Handles the UpdateDeviceStatusCommand.
     *
     * @param command the device and its new status
     * @return the device as stored
     * @throws ValidationException if the status is missing
     * @throws NotFoundException if the device is not registered
     */
    @Observed(name = "command.handler", contextualName = "update-device-status")
    public Device handle(UpdateDeviceStatusCommand command) {
        if (command.getStatus() == null) {
            throw new ValidationException("Invalid status");
        }
        accessGuard.requireAccess(command.getCaller(), command.getDeviceId());

        Instant seenAt = Instant.now();
        Device device = deviceRepository.updateStatus(command.getDeviceId(), command.getStatus(), seenAt)
                .orElseThrow(() -> new NotFoundException("Device not found: " + command.getDeviceId()));

        log.info("Device status updated: deviceId={}, status={}, lastSeen={}",
                device.getId(), device.getStatus(), device.getLastSeen());
        return device;
    }
}
