package com.koni.ems.application.command;

import com.koni.ems.application.lifecycle.DeviceLifecycleService;
import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.PermissionDeniedException;
import com.koni.ems.domain.exception.RelationNameCollisionException;
import com.koni.ems.domain.exception.StorageException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.DeviceStoreState;
import com.koni.ems.domain.model.RegisterMapping;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.StoreProvisioning;
import com.koni.ems.domain.register.RegisterDataType;
import com.koni.ems.domain.repository.DeviceRepository;
import com.koni.ems.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RegisterDeviceCommandHandler.
 * Tests defaults, validation, relation name collisions and compensation of failed registry writes.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class RegisterDeviceCommandHandlerTest {

    private static final Caller ADMIN = Caller.admin("u-admin");
    private static final StoreProvisioning NEW_RELATION =
            new StoreProvisioning(DeviceStoreState.ABSENT, DeviceStoreState.COMPRESSED);
    private static final StoreProvisioning EXISTING_RELATION =
            new StoreProvisioning(DeviceStoreState.COMPRESSED, DeviceStoreState.COMPRESSED);

    @Mock
    private DeviceAccessGuard accessGuard;

    @Mock
    private DeviceRepository deviceRepository;

    @Mock
    private DeviceLifecycleService lifecycleService;

    private RegisterDeviceCommandHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(lifecycleService.withProvisioning(any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(0)).get());
        lenient().when(deviceRepository.save(any(Device.class))).thenAnswer(invocation -> invocation.getArgument(0));

        handler = new RegisterDeviceCommandHandler(accessGuard, deviceRepository, lifecycleService);
    }

    @Test
    void shouldProvisionRelationBeforeWritingRegistry() {
        // Given
        when(deviceRepository.findIdByRelationName(RelationName.forDevice("pm-1"))).thenReturn(Optional.empty());
        when(deviceRepository.existsById("pm-1")).thenReturn(false);
        when(lifecycleService.onDeviceCreated("pm-1")).thenReturn(NEW_RELATION);

        // When
        Device saved = handler.handle(command("pm-1", "PM5320", null));

        // Then
        InOrder inOrder = inOrder(lifecycleService, deviceRepository);
        inOrder.verify(lifecycleService).onDeviceCreated("pm-1");
        inOrder.verify(deviceRepository).save(any(Device.class));

        assertThat(saved.getId()).isEqualTo("pm-1");
        assertThat(saved.getType()).isEqualTo("PM5320");
        assertThat(saved.getStatus()).isEqualTo(DeviceStatus.OFFLINE);
        assertThat(saved.isIncludeInTotalSummary()).isTrue();
        assertThat(saved.getSubnetMask()).isEqualTo("255.255.255.0");
        assertThat(saved.getSlaveAddress()).isEqualTo(1);
        assertThat(saved.mappingFor("Ptotal")).isPresent();
    }

    @Test
    void shouldKeepExplicitRegisterMap() {
        // Given
        List<RegisterMapping> registerMap = List.of(new RegisterMapping("VR", 3000, RegisterDataType.FLOAT32, "Voltage"));
        when(deviceRepository.findIdByRelationName(any())).thenReturn(Optional.empty());

        // When
        Device saved = handler.handle(command("custom-1", null, registerMap));

        // Then
        assertThat(saved.getType()).isEqualTo("Custom");
        assertThat(saved.getRegisterMap()).containsExactlyElementsOf(registerMap);
    }

    @Test
    void shouldRejectRelationNameOwnedByAnotherDevice() {
        // Given
        when(deviceRepository.findIdByRelationName(RelationName.forDevice("meter_a"))).thenReturn(Optional.of("Meter-A"));

        // When / Then
        assertThatThrownBy(() -> handler.handle(command("meter_a", "Custom", null)))
                .isInstanceOf(RelationNameCollisionException.class);

        verify(lifecycleService, never()).onDeviceCreated(any());
        verify(deviceRepository, never()).save(any());
    }

    @Test
    void shouldUpdateDeviceOwningItsRelation() {
        // Given
        when(deviceRepository.findIdByRelationName(RelationName.forDevice("pm-1"))).thenReturn(Optional.of("pm-1"));
        when(deviceRepository.existsById("pm-1")).thenReturn(true);

        // When
        handler.handle(command("pm-1", "PM5320", null));

        // Then
        verify(lifecycleService).onDeviceCreated("pm-1");
        verify(deviceRepository).save(any(Device.class));
    }

    @Test
    void shouldDropNewRelationWhenRegistryWriteFails() {
        // Given
        when(deviceRepository.findIdByRelationName(any())).thenReturn(Optional.empty());
        when(deviceRepository.existsById("pm-1")).thenReturn(false);
        when(lifecycleService.onDeviceCreated("pm-1")).thenReturn(NEW_RELATION);
        when(deviceRepository.save(any(Device.class))).thenThrow(new IllegalStateException("registry down"));

        // When / Then
        assertThatThrownBy(() -> handler.handle(command("pm-1", "PM5320", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("registry down");

        verify(lifecycleService).onDeviceDeleted("pm-1");
    }

    @Test
    void shouldKeepExistingRelationWhenUpdateFails() {
        when(deviceRepository.findIdByRelationName(any())).thenReturn(Optional.of("pm-1"));
        when(deviceRepository.existsById("pm-1")).thenReturn(true);
        when(deviceRepository.save(any(Device.class))).thenThrow(new IllegalStateException("registry down"));

        assertThatThrownBy(() -> handler.handle(command("pm-1", "PM5320", null)))
                .isInstanceOf(IllegalStateException.class);

        verify(lifecycleService, never()).onDeviceDeleted(any());
    }

    @Test
    void shouldAttachCompensationFailureAsSuppressed() {
        // Given
        when(deviceRepository.findIdByRelationName(any())).thenReturn(Optional.empty());
        when(deviceRepository.existsById("pm-1")).thenReturn(false);
        when(lifecycleService.onDeviceCreated("pm-1")).thenReturn(NEW_RELATION);
        when(deviceRepository.save(any(Device.class))).thenThrow(new IllegalStateException("registry down"));
        doThrow(new StorageException("drop failed")).when(lifecycleService).onDeviceDeleted("pm-1");

        // When / Then
        assertThatThrownBy(() -> handler.handle(command("pm-1", "PM5320", null)))
                .isInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    @Test
    void shouldKeepRelationItDidNotCreateWhenRegistryWriteFails() {
        // Given
        when(deviceRepository.findIdByRelationName(RelationName.forDevice("meter_a"))).thenReturn(Optional.empty());
        when(deviceRepository.existsById("meter_a")).thenReturn(false);
        when(lifecycleService.onDeviceCreated("meter_a")).thenReturn(EXISTING_RELATION);
        when(deviceRepository.save(any(Device.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates idx_devices_relation_name"));

        // When / Then
        assertThatThrownBy(() -> handler.handle(command("meter_a", "Custom", null)))
                .isInstanceOf(DataIntegrityViolationException.class);

        verify(lifecycleService, never()).onDeviceDeleted(any());
    }

    @Test
    void shouldKeepRelationClaimedByAnotherDeviceMeanwhile() {
        // Given
        RelationName relation = RelationName.forDevice("Meter-A");
        when(deviceRepository.findIdByRelationName(relation))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of("meter_a"));
        when(deviceRepository.existsById("Meter-A")).thenReturn(false);
        when(lifecycleService.onDeviceCreated("Meter-A")).thenReturn(NEW_RELATION);
        when(deviceRepository.save(any(Device.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates idx_devices_relation_name"));

        // When / Then
        assertThatThrownBy(() -> handler.handle(command("Meter-A", "Custom", null)))
                .isInstanceOf(DataIntegrityViolationException.class);

        verify(lifecycleService, never()).onDeviceDeleted(any());
    }

    @Test
    void shouldNotRegisterDeviceWhenRelationCannotBeCreated() {
        when(deviceRepository.findIdByRelationName(any())).thenReturn(Optional.empty());
        when(lifecycleService.onDeviceCreated("pm-1")).thenThrow(new StorageException("create failed"));

        assertThatThrownBy(() -> handler.handle(command("pm-1", "PM5320", null)))
                .isInstanceOf(StorageException.class);

        verify(deviceRepository, never()).save(any());
    }

    @Test
    void shouldRequireAdministrator() {
        Caller user = new Caller("u-2", "user");
        doThrow(new PermissionDeniedException("Administrator role required")).when(accessGuard).requireAdmin(user);

        assertThatThrownBy(() -> handler.handle(new RegisterDeviceCommand(
                user, "pm-1", "n", null, "10.0.0.1", null, null, null, null, null)))
                .isInstanceOf(PermissionDeniedException.class);

        verifyNoInteractions(deviceRepository, lifecycleService);
    }

    @Test
    void shouldValidateAttributes() {
        assertThatThrownBy(() -> handler.handle(new RegisterDeviceCommand(
                ADMIN, " ", "n", null, "10.0.0.1", null, null, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("deviceId is required");

        assertThatThrownBy(() -> handler.handle(new RegisterDeviceCommand(
                ADMIN, "pm-1", "n", null, null, null, null, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("ipAddress is required");

        assertThatThrownBy(() -> handler.handle(new RegisterDeviceCommand(
                ADMIN, "pm-1", "n", null, "10.0.0.1", null, 300, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("slaveAddress must be between 0 and 255");

        List<RegisterMapping> duplicated = List.of(
                new RegisterMapping("VR", 1, RegisterDataType.FLOAT32, null),
                new RegisterMapping("VR", 3, RegisterDataType.FLOAT32, null));
        assertThatThrownBy(() -> handler.handle(command("pm-1", "Custom", duplicated)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("registerMap has duplicate parameter VR");

        verifyNoInteractions(lifecycleService);
    }

    private static RegisterDeviceCommand command(String id, String type, List<RegisterMapping> registerMap) {
        return new RegisterDeviceCommand(ADMIN, id, "Feeder " + id, type, "10.0.0.9",
                null, null, null, null, registerMap);
    }
}
