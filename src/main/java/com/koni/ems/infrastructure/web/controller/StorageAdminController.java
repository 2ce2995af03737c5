package com.koni.ems.infrastructure.web.controller;

import com.koni.ems.application.service.StorageAdministrationService;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DeviceStoreState;
import com.koni.ems.domain.model.ReclaimReport;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.infrastructure.web.dto.RetentionRequest;
import com.koni.ems.infrastructure.web.dto.StoreStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * REST controller for storage administration (admin only).
 *
 * Endpoints:
 * - POST /api/v1/admin/storage/reclaim: Drop relations no device owns
 * - PUT /api/v1/admin/storage/{deviceId}/retention: Attach the retention policy
 * - DELETE /api/v1/admin/storage/{deviceId}/retention: Remove the retention policy
 * - GET /api/v1/admin/storage/{deviceId}: Provisioning state of the device relation
 */
@RestController
@RequestMapping("/api/v1/admin/storage")
@RequiredArgsConstructor
@Slf4j
public class StorageAdminController {

    private final StorageAdministrationService administrationService;

    @PostMapping("/reclaim")
    public ResponseEntity<ReclaimReport> reclaimOrphans(Caller caller) {
        return ResponseEntity.ok(administrationService.reclaimOrphans(caller));
    }

    @PutMapping("/{deviceId}/retention")
    public ResponseEntity<Map<String, Object>> setRetention(
            Caller caller,
            @PathVariable String deviceId,
            @RequestBody(required = false) @Valid RetentionRequest request) {
        Duration period = request == null || request.getDays() == null ? null : Duration.ofDays(request.getDays());
        Duration applied = administrationService.setRetention(caller, deviceId, period);
        return ResponseEntity.ok(Map.of("deviceId", deviceId, "retentionDays", applied.toDays()));
    }

    @DeleteMapping("/{deviceId}/retention")
    public ResponseEntity<Map<String, Object>> removeRetention(Caller caller, @PathVariable String deviceId) {
        int removed = administrationService.removeRetention(caller, deviceId);
        return ResponseEntity.ok(Map.of("deviceId", deviceId, "removed", removed));
    }

    @GetMapping("/{deviceId}")
    public ResponseEntity<StoreStatusResponse> inspect(Caller caller, @PathVariable String deviceId) {
        DeviceStoreState state = administrationService.inspect(caller, deviceId);
        return ResponseEntity.ok(new StoreStatusResponse(
                deviceId, RelationName.forDevice(deviceId).getValue(), state));
    }
}
