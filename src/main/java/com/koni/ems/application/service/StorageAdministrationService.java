package com.koni.ems.application.service;

import com.koni.ems.application.lifecycle.DeviceLifecycleService;
import com.koni.ems.application.port.DeviceStoreManager;
import com.koni.ems.application.port.RetentionPolicyManager;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DeviceStoreState;
import com.koni.ems.domain.model.ReclaimReport;
import com.koni.ems.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Administrative storage operations. Every operation requires the admin role.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageAdministrationService {

    private final DeviceAccessGuard accessGuard;
    private final DeviceRepository deviceRepository;
    private final DeviceLifecycleService lifecycleService;
    private final DeviceStoreManager storeManager;
    private final RetentionPolicyManager retentionManager;

    public ReclaimReport reclaimOrphans(Caller caller) {
        accessGuard.requireAdmin(caller);
        log.info("Orphan sweep requested: userId={}", caller.getUserId());
        return lifecycleService.reclaimOrphans();
    }

    /**
     * Attaches the retention policy to one device.
     *
     * @param period the retention period, or {@code null} for the configured default
     */
    public Duration setRetention(Caller caller, String deviceId, Duration period) {
        accessGuard.requireAdmin(caller);
        requireRegistered(deviceId);
        Duration effective = period != null ? period : lifecycleService.getRetentionPeriod();
        retentionManager.setRetention(deviceId, effective);
        return effective;
    }

    public int removeRetention(Caller caller, String deviceId) {
        accessGuard.requireAdmin(caller);
        requireRegistered(deviceId);
        return retentionManager.removeRetention(deviceId);
    }

    public DeviceStoreState inspect(Caller caller, String deviceId) {
        accessGuard.requireAdmin(caller);
        requireRegistered(deviceId);
        return storeManager.inspect(deviceId);
    }

    private void requireRegistered(String deviceId) {
        if (!deviceRepository.existsById(deviceId)) {
            throw new NotFoundException("Device not found: " + deviceId);
        }
    }
}
