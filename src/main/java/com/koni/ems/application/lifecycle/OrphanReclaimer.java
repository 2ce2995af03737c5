package com.koni.ems.application.lifecycle;

import com.koni.ems.application.port.DeviceStoreManager;
import com.koni.ems.domain.model.ReclaimReport;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.repository.DeviceRepository;
import com.koni.ems.infrastructure.observability.IngestionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops device relations that no registered device owns.
 *
 * <p>The device list is read once per sweep. A relation is only dropped when its name
 * carries the device prefix, is not a registry table and matches no device of that
 * snapshot. Each drop stands on its own: a failure is logged and the sweep goes on.
 * The sweep never creates relations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrphanReclaimer {

    static final Set<String> PROTECTED_TABLES = Set.of("devices", "users", "user_device_permissions");

    private final DeviceRepository deviceRepository;
    private final DeviceStoreManager storeManager;
    private final IngestionMetrics metrics;

    /**
     * Runs one sweep.
     *
     * @return what was examined, dropped and left behind; empty if the catalog or the
     * registry could not be read
     */
    public ReclaimReport reclaimOrphans() {
        Set<RelationName> owned;
        List<RelationName> relations;
        try {
            owned = deviceRepository.findAllIds().stream()
                    .map(RelationName::forDevice)
                    .collect(Collectors.toSet());
            relations = storeManager.listDeviceRelations();
        } catch (RuntimeException e) {
            log.error("Orphan sweep skipped, could not read devices or relations: {}", e.getMessage(), e);
            return ReclaimReport.empty();
        }

        List<String> dropped = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (RelationName relation : relations) {
            if (owned.contains(relation) || PROTECTED_TABLES.contains(relation.getValue())) {
                continue;
            }
            try {
                storeManager.dropRelation(relation);
                dropped.add(relation.getValue());
                log.info("Orphan relation dropped: relation={}", relation);
            } catch (RuntimeException e) {
                failed.add(relation.getValue());
                log.warn("Failed to drop orphan relation: relation={}, error={}", relation, e.getMessage());
            }
        }

        metrics.recordOrphansReclaimed(dropped.size());
        log.info("Orphan sweep finished: examined={}, dropped={}, failed={}",
                relations.size(), dropped.size(), failed.size());
        return new ReclaimReport(relations.size(), List.copyOf(dropped), List.copyOf(failed));
    }
}
