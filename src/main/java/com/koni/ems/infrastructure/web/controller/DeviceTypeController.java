package com.koni.ems.infrastructure.web.controller;

import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.register.DeviceTypeCatalog;
import com.koni.ems.domain.register.DeviceTypeProfile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the built-in device type catalog.
 */
@RestController
@RequestMapping("/api/v1/device-types")
public class DeviceTypeController {

    @GetMapping
    public ResponseEntity<List<String>> getDeviceTypes() {
        return ResponseEntity.ok(DeviceTypeCatalog.deviceTypes());
    }

    @GetMapping("/{type}")
    public ResponseEntity<DeviceTypeProfile> getDeviceType(@PathVariable String type) {
        if (!DeviceTypeCatalog.isKnown(type)) {
            throw new NotFoundException("Unknown device type: " + type);
        }
        return ResponseEntity.ok(DeviceTypeCatalog.profile(type));
    }
}
