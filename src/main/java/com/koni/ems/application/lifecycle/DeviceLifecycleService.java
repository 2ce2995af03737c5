package com.koni.ems.application.lifecycle;

import com.koni.ems.application.port.DeviceStoreManager;
import com.koni.ems.application.port.RetentionPolicyManager;
import com.koni.ems.domain.model.ReclaimReport;
import com.koni.ems.domain.model.StoreProvisioning;
import com.koni.ems.domain.repository.DeviceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Keeps device relations in step with the device registry.
 * Relation creation is required; policy attachment after it is best-effort.
 *
 * <p>An orphan sweep must not see a relation whose registry row is still being written,
 * so registrations run under the shared side of a lock and sweeps under the exclusive side.
 */
@Slf4j
@Service
public class DeviceLifecycleService {

    private final DeviceStoreManager storeManager;
    private final RetentionPolicyManager retentionManager;
    private final OrphanReclaimer orphanReclaimer;
    private final DeviceRepository deviceRepository;
    private final Duration retentionPeriod;
    private final boolean retentionOnCreate;
    private final ReadWriteLock provisioningLock = new ReentrantReadWriteLock();

    public DeviceLifecycleService(
            DeviceStoreManager storeManager,
            RetentionPolicyManager retentionManager,
            OrphanReclaimer orphanReclaimer,
            DeviceRepository deviceRepository,
            @Value("${ems.storage.retention-period:90d}") Duration retentionPeriod,
            @Value("${ems.storage.retention-on-create:true}") boolean retentionOnCreate) {
        this.storeManager = storeManager;
        this.retentionManager = retentionManager;
        this.orphanReclaimer = orphanReclaimer;
        this.deviceRepository = deviceRepository;
        this.retentionPeriod = retentionPeriod;
        this.retentionOnCreate = retentionOnCreate;
    }

    /**
     * Creates the relation of a new device and attaches the retention policy.
     *
     * @return whether the relation was created by this call and the state it reached
     * @throws com.koni.ems.domain.exception.StorageException if the relation cannot be created
     */
    public StoreProvisioning onDeviceCreated(String deviceId) {
        StoreProvisioning provisioning = storeManager.createDeviceStore(deviceId);
        if (retentionOnCreate) {
            try {
                retentionManager.setRetention(deviceId, retentionPeriod);
            } catch (RuntimeException e) {
                log.warn("Retention policy not attached: deviceId={}, error={}", deviceId, e.getMessage());
            }
        }
        return provisioning;
    }

    public void onDeviceDeleted(String deviceId) {
        storeManager.deleteDeviceStore(deviceId);
    }

    public ReclaimReport reclaimOrphans() {
        provisioningLock.writeLock().lock();
        try {
            return orphanReclaimer.reclaimOrphans();
        } finally {
            provisioningLock.writeLock().unlock();
        }
    }

    /**
     * Runs a registration step that creates a relation before its registry row exists.
     * Registrations may run concurrently with each other but not with an orphan sweep.
     */
    public <T> T withProvisioning(Supplier<T> registration) {
        provisioningLock.readLock().lock();
        try {
            return registration.get();
        } finally {
            provisioningLock.readLock().unlock();
        }
    }

    /**
     * Attaches the retention policy to every registered device.
     *
     * @return the number of devices the policy was attached to
     */
    public int setRetentionForAllDevices(Duration period) {
        List<String> deviceIds = deviceRepository.findAllIds();
        int applied = 0;
        for (String deviceId : deviceIds) {
            try {
                retentionManager.setRetention(deviceId, period);
                applied++;
            } catch (RuntimeException e) {
                log.warn("Retention policy not attached: deviceId={}, error={}", deviceId, e.getMessage());
            }
        }
        log.info("Retention policy applied: devices={}, applied={}, period={}", deviceIds.size(), applied, period);
        return applied;
    }

    public Duration getRetentionPeriod() {
        return retentionPeriod;
    }
}
