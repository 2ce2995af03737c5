package com.koni.ems.application.lifecycle;

import com.koni.ems.application.service.StorageReadiness;
import com.koni.ems.domain.exception.DatabaseUnavailableException;
import com.koni.ems.domain.repository.DeviceRepository;
import com.koni.ems.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StorageInitializer.
 * Tests the order of the startup steps and that none of them keeps the service from becoming ready.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class StorageInitializerTest {

    @Mock
    private DeviceLifecycleService lifecycleService;

    @Mock
    private DeviceRepository deviceRepository;

    private final StorageReadiness readiness = new StorageReadiness();

    @Test
    void shouldRecordRelationNamesBeforeOrphanSweep() {
        // Given
        when(deviceRepository.assignMissingRelationNames()).thenReturn(2);

        // When
        new StorageInitializer(lifecycleService, deviceRepository, readiness, true, false)
                .run(new DefaultApplicationArguments());

        // Then
        InOrder inOrder = inOrder(deviceRepository, lifecycleService);
        inOrder.verify(deviceRepository).assignMissingRelationNames();
        inOrder.verify(lifecycleService).reclaimOrphans();
        verify(lifecycleService, never()).setRetentionForAllDevices(any());
        assertThat(readiness.isReady()).isTrue();
    }

    @Test
    void shouldBecomeReadyWhenRelationNamesCannotBeRecorded() {
        when(deviceRepository.assignMissingRelationNames())
                .thenThrow(new DatabaseUnavailableException("Database is unavailable"));

        new StorageInitializer(lifecycleService, deviceRepository, readiness, false, false)
                .run(new DefaultApplicationArguments());

        verify(lifecycleService, never()).reclaimOrphans();
        assertThat(readiness.isReady()).isTrue();
    }
}
