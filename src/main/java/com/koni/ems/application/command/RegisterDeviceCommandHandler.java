package com.koni.ems.application.command;

import com.koni.ems.application.lifecycle.DeviceLifecycleService;
import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.RelationNameCollisionException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RegisterMapping;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.StoreProvisioning;
import com.koni.ems.domain.register.DeviceTypeCatalog;
import com.koni.ems.domain.register.DeviceTypeProfile;
import com.koni.ems.domain.repository.DeviceRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Command handler registering devices.
 *
 * The device relation is provisioned before the registry row is written, so a device
 * never becomes visible without a complete relation. If the registry write fails for a
 * new device, the relation is dropped again only when this registration created it and
 * no other device owns it by then; a crash in between is cleaned up by the next orphan sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegisterDeviceCommandHandler {

    static final int MAX_ID_LENGTH = 255;

    private final DeviceAccessGuard accessGuard;
    private final DeviceRepository deviceRepository;
    private final DeviceLifecycleService lifecycleService;

    /**
     * Handles the RegisterDeviceCommand.
     *
     * @param command the device attributes
     * @return the stored device
     * @throws ValidationException if an attribute is invalid
     * @throws RelationNameCollisionException if another device already owns the relation name
     */
    @Observed(name = "command.handler", contextualName = "register-device")
    public Device handle(RegisterDeviceCommand command) {
        accessGuard.requireAdmin(command.getCaller());

        Device device = toDevice(command);
        RelationName relation = device.relationName();

        boolean existed = deviceRepository.existsById(device.getId());
        Device saved = lifecycleService.withProvisioning(() -> provision(device, relation, existed));

        log.info("Device {}: deviceId={}, type={}, relation={}",
                existed ? "updated" : "registered", saved.getId(), saved.getType(), relation);
        return saved;
    }

    private Device provision(Device device, RelationName relation, boolean existed) {
        requireOwnership(device.getId(), relation);

        StoreProvisioning provisioning = lifecycleService.onDeviceCreated(device.getId());
        try {
            return deviceRepository.save(device);
        } catch (RuntimeException e) {
            if (!existed && provisioning.createdRelation()) {
                compensate(device.getId(), relation, e);
            }
            throw e;
        }
    }

    private void requireOwnership(String deviceId, RelationName relation) {
        Optional<String> owner = deviceRepository.findIdByRelationName(relation);
        if (owner.isPresent() && !owner.get().equals(deviceId)) {
            throw new RelationNameCollisionException(deviceId, owner.get(), relation.getValue());
        }
    }

    private void compensate(String deviceId, RelationName relation, RuntimeException cause) {
        Optional<String> owner;
        try {
            owner = deviceRepository.findIdByRelationName(relation);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Relation owner unknown, keeping relation for the next orphan sweep: deviceId={}, relation={}",
                    deviceId, relation, e);
            return;
        }
        if (owner.isPresent() && !owner.get().equals(deviceId)) {
            log.warn("Registry write failed, relation now owned by another device: deviceId={}, owner={}, relation={}",
                    deviceId, owner.get(), relation);
            return;
        }

        log.warn("Registry write failed, dropping new relation: deviceId={}, error={}", deviceId, cause.getMessage());
        try {
            lifecycleService.onDeviceDeleted(deviceId);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Relation of unregistered device left behind, next orphan sweep drops it: deviceId={}",
                    deviceId, e);
        }
    }

    private Device toDevice(RegisterDeviceCommand command) {
        String id = command.getDeviceId();
        if (id == null || id.isBlank()) {
            throw new ValidationException("deviceId is required");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new ValidationException("deviceId must be at most " + MAX_ID_LENGTH + " characters");
        }
        if (command.getName() == null || command.getName().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (command.getIpAddress() == null || command.getIpAddress().isBlank()) {
            throw new ValidationException("ipAddress is required");
        }
        String type = command.getType() == null || command.getType().isBlank() ? "Custom" : command.getType();
        DeviceTypeProfile profile = DeviceTypeCatalog.profile(type);

        int slaveAddress = command.getSlaveAddress() != null
                ? command.getSlaveAddress()
                : profile.getDefaultSlaveAddress();
        if (slaveAddress < 0 || slaveAddress > 255) {
            throw new ValidationException("slaveAddress must be between 0 and 255");
        }

        List<RegisterMapping> registerMap = command.getRegisterMap() == null || command.getRegisterMap().isEmpty()
                ? profile.getRegisterMappings()
                : command.getRegisterMap();
        validateRegisterMap(registerMap);

        return Device.builder()
                .id(id)
                .name(command.getName())
                .type(type)
                .ipAddress(command.getIpAddress())
                .subnetMask(command.getSubnetMask() != null ? command.getSubnetMask() : profile.getDefaultSubnetMask())
                .slaveAddress(slaveAddress)
                .status(command.getStatus() != null ? command.getStatus() : DeviceStatus.OFFLINE)
                .includeInTotalSummary(command.getIncludeInTotalSummary() == null || command.getIncludeInTotalSummary())
                .registerMap(List.copyOf(registerMap))
                .build();
    }

    private static void validateRegisterMap(List<RegisterMapping> registerMap) {
        Set<String> parameters = new HashSet<>();
        for (RegisterMapping mapping : registerMap) {
            if (mapping == null || mapping.getParameter() == null || mapping.getParameter().isBlank()) {
                throw new ValidationException("registerMap entries need a parameter");
            }
            if (mapping.getDataType() == null) {
                throw new ValidationException("registerMap entry " + mapping.getParameter() + " needs a dataType");
            }
            if (mapping.getAddress() < 0 || mapping.getAddress() > 65535) {
                throw new ValidationException("registerMap entry " + mapping.getParameter()
                        + " has an invalid address");
            }
            if (mapping.getRegisterCount() != null && mapping.getRegisterCount() < 1) {
                throw new ValidationException("registerMap entry " + mapping.getParameter()
                        + " needs at least 1 register");
            }
            if (!parameters.add(mapping.getParameter())) {
                throw new ValidationException("registerMap has duplicate parameter " + mapping.getParameter());
            }
        }
    }
}
