package com.koni.ems.application.query;

import com.koni.ems.application.port.DeviceAccessPolicy;
import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.PermissionDeniedException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;

/**
 * Query handler for the device registry.
 *
 * Responsibilities:
 * - Return every device to administrators
 * - Return only permitted devices to other callers
 * - Handle empty results gracefully
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetDevicesQueryHandler {

    private final DeviceRepository deviceRepository;
    private final DeviceAccessPolicy accessPolicy;
    private final DeviceAccessGuard accessGuard;

    /**
     * Handles the GetDevicesQuery.
     *
     * @param query the query carrying the caller
     * @return the visible devices, or an empty list if there are none
     */
    @Transactional(readOnly = true)
    public List<Device> handle(GetDevicesQuery query) {
        Caller caller = query.getCaller();
        if (caller == null || caller.isAnonymous()) {
            throw new PermissionDeniedException("Authentication required");
        }

        List<Device> devices;
        if (caller.isAdmin()) {
            devices = deviceRepository.findAll();
        } else {
            Set<String> permitted = accessPolicy.accessibleDeviceIds(caller.getUserId());
            devices = permitted.isEmpty() ? List.of() : deviceRepository.findAllById(permitted);
        }

        log.info("Retrieved {} devices: userId={}", devices.size(), caller.getUserId());
        return devices;
    }

    @Transactional(readOnly = true)
    public Device handle(GetDeviceQuery query) {
        return accessGuard.requireDevice(query.getCaller(), query.getDeviceId());
    }
}
