package com.koni.ems.application.lifecycle;

import com.koni.ems.application.service.StorageReadiness;
import com.koni.ems.domain.repository.DeviceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Storage startup phase: relation names of older registry rows, orphan sweep,
 * optional retention sweep, then readiness.
 * Runs before Spring Boot reports the application as accepting traffic.
 */
@Slf4j
@Component
public class StorageInitializer implements ApplicationRunner {

    private final DeviceLifecycleService lifecycleService;
    private final DeviceRepository deviceRepository;
    private final StorageReadiness readiness;
    private final boolean reclaimOrphansOnStartup;
    private final boolean applyRetentionOnStartup;

    public StorageInitializer(
            DeviceLifecycleService lifecycleService,
            DeviceRepository deviceRepository,
            StorageReadiness readiness,
            @Value("${ems.storage.reclaim-orphans-on-startup:true}") boolean reclaimOrphansOnStartup,
            @Value("${ems.storage.apply-retention-on-startup:false}") boolean applyRetentionOnStartup) {
        this.lifecycleService = lifecycleService;
        this.deviceRepository = deviceRepository;
        this.readiness = readiness;
        this.reclaimOrphansOnStartup = reclaimOrphansOnStartup;
        this.applyRetentionOnStartup = applyRetentionOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            int assigned = deviceRepository.assignMissingRelationNames();
            if (assigned > 0) {
                log.info("Relation names recorded for older devices: devices={}", assigned);
            }
        } catch (RuntimeException e) {
            log.warn("Relation names of older devices not recorded: {}", e.getMessage());
        }

        if (reclaimOrphansOnStartup) {
            lifecycleService.reclaimOrphans();
        } else {
            log.info("Orphan sweep on startup disabled");
        }

        if (applyRetentionOnStartup) {
            try {
                lifecycleService.setRetentionForAllDevices(lifecycleService.getRetentionPeriod());
            } catch (RuntimeException e) {
                log.warn("Retention sweep on startup failed: {}", e.getMessage());
            }
        }

        readiness.markReady();
    }
}
