package com.koni.ems.application.command;

import com.koni.ems.application.lifecycle.DeviceLifecycleService;
import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.repository.DeviceRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Command handler removing devices. The relation is dropped first, then the registry row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteDeviceCommandHandler {

    private final DeviceAccessGuard accessGuard;
    private final DeviceRepository deviceRepository;
    private final DeviceLifecycleService lifecycleService;

    @Observed(name = "command.handler", contextualName = "delete-device")
    public void handle(DeleteDeviceCommand command) {
        accessGuard.requireAdmin(command.getCaller());

        String deviceId = command.getDeviceId();
        if (!deviceRepository.existsById(deviceId)) {
            throw new NotFoundException("Device not found: " + deviceId);
        }

        lifecycleService.onDeviceDeleted(deviceId);
        deviceRepository.deleteById(deviceId);
        log.info("Device deleted: deviceId={}", deviceId);
    }
}
