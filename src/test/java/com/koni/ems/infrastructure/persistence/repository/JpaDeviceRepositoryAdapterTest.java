package com.koni.ems.infrastructure.persistence.repository;

import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RegisterMapping;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.register.RegisterDataType;
import com.koni.ems.domain.repository.DeviceRepository;
import com.koni.ems.infrastructure.persistence.entity.DeviceEntity;
import com.koni.ems.infrastructure.persistence.entity.DevicePermissionEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the device registry adapter against an in-memory database.
 */
@DataJpaTest
@Import({JpaDeviceRepositoryAdapter.class, JpaDeviceAccessPolicy.class})
@ActiveProfiles("test")
class JpaDeviceRepositoryAdapterTest {

    @Autowired
    private DeviceRepository deviceRepository;

    @Autowired
    private JpaDeviceAccessPolicy accessPolicy;

    @Autowired
    private DevicePermissionJpaRepository permissionRepository;

    @Autowired
    private DeviceJpaRepository jpaRepository;

    @Test
    void shouldRoundTripDeviceWithRegisterMap() {
        // Given
        Device device = device("PM-1", List.of(
                new RegisterMapping("Ptotal", 40037, RegisterDataType.FLOAT32, "Total Active Power (kW)"),
                new RegisterMapping("Model", 30, RegisterDataType.UTF8, "Model", 10)));

        // When
        deviceRepository.save(device);
        Device loaded = deviceRepository.findById("PM-1").orElseThrow();

        // Then
        assertThat(loaded.getName()).isEqualTo("Feeder PM-1");
        assertThat(loaded.getStatus()).isEqualTo(DeviceStatus.ONLINE);
        assertThat(loaded.getRegisterMap()).containsExactlyElementsOf(device.getRegisterMap());
        assertThat(loaded.mappingFor("Model").orElseThrow().effectiveRegisterCount()).isEqualTo(10);
    }

    @Test
    void shouldRecordRelationNameOfDevice() {
        deviceRepository.save(device("PM-1", List.of()));

        assertThat(deviceRepository.findIdByRelationName(RelationName.forDevice("pm_1"))).contains("PM-1");
        assertThat(deviceRepository.findIdByRelationName(RelationName.forDevice("pm-2"))).isEmpty();
    }

    @Test
    void shouldReplaceAttributesOnSecondSave() {
        // Given
        deviceRepository.save(device("PM-1", List.of()));

        // When
        deviceRepository.save(device("PM-1", List.of()).toBuilder().name("Renamed").status(DeviceStatus.OFFLINE).build());

        // Then
        assertThat(deviceRepository.findAll()).hasSize(1);
        Device loaded = deviceRepository.findById("PM-1").orElseThrow();
        assertThat(loaded.getName()).isEqualTo("Renamed");
        assertThat(loaded.getStatus()).isEqualTo(DeviceStatus.OFFLINE);
    }

    @Test
    void shouldListDevicesAndIdsInIdOrder() {
        deviceRepository.save(device("b", List.of()));
        deviceRepository.save(device("a", List.of()));
        deviceRepository.save(device("c", List.of()));

        assertThat(deviceRepository.findAll()).extracting(Device::getId).containsExactly("a", "b", "c");
        assertThat(deviceRepository.findAllById(List.of("c", "a"))).extracting(Device::getId).containsExactly("a", "c");
        assertThat(deviceRepository.findAllById(List.of())).isEmpty();
        assertThat(deviceRepository.findAllIds()).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void shouldReportWhetherDeleteRemovedDevice() {
        deviceRepository.save(device("PM-1", List.of()));

        assertThat(deviceRepository.deleteById("PM-1")).isTrue();
        assertThat(deviceRepository.deleteById("PM-1")).isFalse();
        assertThat(deviceRepository.existsById("PM-1")).isFalse();
    }

    @Test
    void shouldUpdateStatusAndLastSeen() {
        // Given
        deviceRepository.save(device("PM-1", List.of()));
        Instant seenAt = Instant.parse("2025-01-31T13:00:00Z");

        // When
        Device updated = deviceRepository.updateStatus("PM-1", DeviceStatus.CONNECTING, seenAt).orElseThrow();

        // Then
        assertThat(updated.getStatus()).isEqualTo(DeviceStatus.CONNECTING);
        assertThat(updated.getLastSeen()).isEqualTo(seenAt);
        Device loaded = deviceRepository.findById("PM-1").orElseThrow();
        assertThat(loaded.getLastSeen()).isEqualTo(seenAt);
        assertThat(loaded.getName()).isEqualTo("Feeder PM-1");
        assertThat(deviceRepository.updateStatus("ghost", DeviceStatus.ONLINE, seenAt)).isEmpty();
    }

    @Test
    void shouldRecordShortenedRelationNameOfOlderDevice() {
        // Given
        String longId = "substation-north-feeder-07-panel-b-meter-0001";
        jpaRepository.saveAndFlush(legacyEntity(longId));
        assertThat(deviceRepository.findIdByRelationName(RelationName.forDevice(longId))).isEmpty();

        // When
        int assigned = deviceRepository.assignMissingRelationNames();

        // Then
        assertThat(assigned).isEqualTo(1);
        assertThat(deviceRepository.findIdByRelationName(RelationName.forDevice(longId))).contains(longId);
        assertThat(deviceRepository.assignMissingRelationNames()).isZero();
    }

    @Test
    void shouldLeaveOlderDeviceWithoutNameWhenAnotherOwnsIt() {
        // Given
        deviceRepository.save(device("Meter-A", List.of()));
        jpaRepository.saveAndFlush(legacyEntity("meter_a"));

        // When
        int assigned = deviceRepository.assignMissingRelationNames();

        // Then
        assertThat(assigned).isZero();
        assertThat(deviceRepository.findIdByRelationName(RelationName.forDevice("meter_a"))).contains("Meter-A");
        assertThat(jpaRepository.findById("meter_a").orElseThrow().getRelationName()).isNull();
    }

    @Test
    void shouldResolvePermissionsOfUser() {
        // Given
        permissionRepository.save(new DevicePermissionEntity(null, "u-1", "PM-1"));
        permissionRepository.save(new DevicePermissionEntity(null, "u-1", "PM-2"));
        permissionRepository.save(new DevicePermissionEntity(null, "u-2", "PM-3"));

        // Then
        assertThat(accessPolicy.hasAccess("u-1", "PM-1")).isTrue();
        assertThat(accessPolicy.hasAccess("u-1", "PM-3")).isFalse();
        assertThat(accessPolicy.accessibleDeviceIds("u-1")).containsExactlyInAnyOrder("PM-1", "PM-2");
        assertThat(accessPolicy.accessibleDeviceIds("u-9")).isEmpty();
    }

    private static Device device(String id, List<RegisterMapping> registerMap) {
        return Device.builder()
                .id(id)
                .name("Feeder " + id)
                .type("PM5320")
                .ipAddress("10.0.0.1")
                .subnetMask("255.255.255.0")
                .slaveAddress(1)
                .status(DeviceStatus.ONLINE)
                .includeInTotalSummary(true)
                .registerMap(registerMap)
                .build();
    }

    private static DeviceEntity legacyEntity(String id) {
        DeviceEntity entity = new DeviceEntity();
        entity.setId(id);
        entity.setName("Legacy " + id);
        entity.setType("Custom");
        entity.setIpAddress("10.0.0.2");
        entity.setSubnetMask("255.255.255.0");
        entity.setSlaveAddress(1);
        entity.setStatus("offline");
        entity.setIncludeInTotalSummary(true);
        return entity;
    }
}
