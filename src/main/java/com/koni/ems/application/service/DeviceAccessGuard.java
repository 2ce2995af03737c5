package com.koni.ems.application.service;

import com.koni.ems.application.port.DeviceAccessPolicy;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.exception.PermissionDeniedException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Authorizes access to device data.
 * Administrators may access every device; other callers need a permission record for it.
 * Permission is checked before existence, so callers without access cannot probe
 * which device identifiers are registered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceAccessGuard {

    private final DeviceAccessPolicy accessPolicy;
    private final DeviceRepository deviceRepository;

    /**
     * Checks that the caller may access the device and that it is registered.
     *
     * @return the registered device
     * @throws PermissionDeniedException if the caller has no access
     * @throws NotFoundException if no device has the identifier
     */
    public Device requireDevice(Caller caller, String deviceId) {
        requireAccess(caller, deviceId);
        return deviceRepository.findById(deviceId)
                .orElseThrow(() -> new NotFoundException("Device not found: " + deviceId));
    }

    public void requireAccess(Caller caller, String deviceId) {
        if (caller == null || caller.isAnonymous()) {
            throw new PermissionDeniedException("Authentication required");
        }
        if (caller.isAdmin()) {
            return;
        }
        if (!accessPolicy.hasAccess(caller.getUserId(), deviceId)) {
            log.debug("Access denied: userId={}, deviceId={}", caller.getUserId(), deviceId);
            throw new PermissionDeniedException("Access denied to device " + deviceId);
        }
    }

    /**
     * @throws PermissionDeniedException unless the caller has the admin role
     */
    public void requireAdmin(Caller caller) {
        if (caller == null || caller.isAnonymous() || !caller.isAdmin()) {
            throw new PermissionDeniedException("Administrator role required");
        }
    }
}
