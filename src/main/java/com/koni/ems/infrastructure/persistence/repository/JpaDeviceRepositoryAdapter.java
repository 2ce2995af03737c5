package com.koni.ems.infrastructure.persistence.repository;

import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.repository.DeviceRepository;
import com.koni.ems.infrastructure.persistence.entity.DeviceEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA adapter for DeviceRepository.
 * Maps between the domain Device and DeviceEntity and keeps the stored relation name
 * in step with the identifier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDeviceRepositoryAdapter implements DeviceRepository {

    private final DeviceJpaRepository jpaRepository;

    @Override
    public Optional<Device> findById(String deviceId) {
        if (deviceId == null) {
            throw new IllegalArgumentException("DeviceId cannot be null");
        }
        return jpaRepository.findById(deviceId).map(this::toDomain);
    }

    @Override
    public boolean existsById(String deviceId) {
        return deviceId != null && jpaRepository.existsById(deviceId);
    }

    @Override
    public List<Device> findAll() {
        return jpaRepository.findAllByOrderByIdAsc().stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<Device> findAllById(Collection<String> deviceIds) {
        if (deviceIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findAllByIdInOrderByIdAsc(deviceIds).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findAllIds() {
        return jpaRepository.findAllIds();
    }

    @Override
    public Optional<String> findIdByRelationName(RelationName relationName) {
        return jpaRepository.findIdByRelationName(relationName.getValue());
    }

    @Override
    @Transactional
    public int assignMissingRelationNames() {
        int assigned = 0;
        for (DeviceEntity entity : jpaRepository.findAllByRelationNameIsNullOrderByIdAsc()) {
            RelationName relation = RelationName.forDevice(entity.getId());
            Optional<String> owner = jpaRepository.findIdByRelationName(relation.getValue());
            if (owner.isPresent()) {
                log.warn("Relation name already recorded for another device: deviceId={}, owner={}, relation={}",
                        entity.getId(), owner.get(), relation);
                continue;
            }
            entity.setRelationName(relation.getValue());
            jpaRepository.saveAndFlush(entity);
            assigned++;
        }
        return assigned;
    }

    /**
     * Inserts the device or overwrites every attribute of the stored one.
     *
     * @param device the device to save
     * @return the device as stored
     */
    @Override
    @Transactional
    public Device save(Device device) {
        if (device == null) {
            throw new IllegalArgumentException("Device cannot be null");
        }

        DeviceEntity entity = jpaRepository.findById(device.getId()).orElseGet(DeviceEntity::new);
        entity.setId(device.getId());
        entity.setName(device.getName());
        entity.setType(device.getType());
        entity.setIpAddress(device.getIpAddress());
        entity.setSubnetMask(device.getSubnetMask());
        entity.setSlaveAddress(device.getSlaveAddress());
        entity.setStatus(device.getStatus().wireName());
        entity.setIncludeInTotalSummary(device.isIncludeInTotalSummary());
        entity.setRegisterMap(new ArrayList<>(device.getRegisterMap()));
        entity.setRelationName(device.relationName().getValue());
        if (device.getLastSeen() != null) {
            entity.setLastSeen(device.getLastSeen());
        }

        return toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public Optional<Device> updateStatus(String deviceId, DeviceStatus status, Instant lastSeen) {
        return jpaRepository.findById(deviceId).map(entity -> {
            entity.setStatus(status.wireName());
            entity.setLastSeen(lastSeen);
            return toDomain(jpaRepository.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional
    public boolean deleteById(String deviceId) {
        if (!jpaRepository.existsById(deviceId)) {
            return false;
        }
        jpaRepository.deleteById(deviceId);
        return true;
    }

    private Device toDomain(DeviceEntity entity) {
        return Device.builder()
                .id(entity.getId())
                .name(entity.getName())
                .type(entity.getType())
                .ipAddress(entity.getIpAddress())
                .subnetMask(entity.getSubnetMask())
                .slaveAddress(entity.getSlaveAddress())
                .status(DeviceStatus.fromWireName(entity.getStatus()))
                .includeInTotalSummary(entity.isIncludeInTotalSummary())
                .registerMap(entity.getRegisterMap() == null ? List.of() : List.copyOf(entity.getRegisterMap()))
                .lastSeen(entity.getLastSeen())
                .build();
    }
}
