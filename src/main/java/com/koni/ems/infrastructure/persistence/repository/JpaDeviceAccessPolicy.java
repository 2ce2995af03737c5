package com.koni.ems.infrastructure.persistence.repository;

import com.koni.ems.application.port.DeviceAccessPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * DeviceAccessPolicy backed by the {@code user_device_permissions} table.
 */
@Component
@RequiredArgsConstructor
public class JpaDeviceAccessPolicy implements DeviceAccessPolicy {

    private final DevicePermissionJpaRepository jpaRepository;

    @Override
    public boolean hasAccess(String userId, String deviceId) {
        return jpaRepository.existsByUserIdAndDeviceId(userId, deviceId);
    }

    @Override
    public Set<String> accessibleDeviceIds(String userId) {
        return new LinkedHashSet<>(jpaRepository.findDeviceIdsByUserId(userId));
    }
}
