package com.koni.ems.application.command;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.DecodeException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.domain.model.MeasurementField;
import com.koni.ems.domain.model.Reading;
import com.koni.ems.domain.model.RegisterMapping;
import com.koni.ems.domain.register.DeviceTypeCatalog;
import com.koni.ems.domain.register.RegisterDataType;
import com.koni.ems.infrastructure.observability.IngestionMetrics;
import com.koni.ems.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IngestRegisterFrameCommandHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class IngestRegisterFrameCommandHandlerTest {

    private static final Caller ADMIN = Caller.admin("u-admin");
    private static final Instant READ_AT = Instant.parse("2025-01-31T13:00:00Z");

    @Mock
    private DeviceAccessGuard accessGuard;

    @Mock
    private IngestDataPointCommandHandler ingestHandler;

    private SimpleMeterRegistry meterRegistry;
    private IngestRegisterFrameCommandHandler handler;
    private Device device;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        handler = new IngestRegisterFrameCommandHandler(accessGuard, ingestHandler, new IngestionMetrics(meterRegistry));

        List<RegisterMapping> registerMap = new ArrayList<>(DeviceTypeCatalog.profile("PM5320").getRegisterMappings());
        registerMap.add(new RegisterMapping("Model", 30, RegisterDataType.UTF8, "Meter model", 10));
        registerMap.add(new RegisterMapping("Serial", 130, RegisterDataType.INT32U, "Serial number"));
        device = Device.builder()
                .id("pm-1")
                .name("PM5320 feeder")
                .type("PM5320")
                .ipAddress("10.0.0.7")
                .subnetMask("255.255.255.0")
                .slaveAddress(1)
                .status(DeviceStatus.ONLINE)
                .includeInTotalSummary(true)
                .registerMap(registerMap)
                .build();
    }

    @Test
    void shouldDecodeFrameWithRegisterMap() {
        // Given
        Map<String, int[]> registers = new LinkedHashMap<>();
        registers.put("Ptotal", new int[]{0x4348, 0x0000});
        registers.put("PFavg", new int[]{0x0384});
        IngestResult stored = new IngestResult(7L, READ_AT);

        when(accessGuard.requireDevice(ADMIN, "pm-1")).thenReturn(device);
        when(ingestHandler.ingest(eq(device), any(Reading.class))).thenReturn(stored);

        // When
        IngestResult result = handler.handle(new IngestRegisterFrameCommand(ADMIN, "pm-1", READ_AT, registers));

        // Then
        assertThat(result).isEqualTo(stored);

        ArgumentCaptor<Reading> captor = ArgumentCaptor.forClass(Reading.class);
        verify(ingestHandler).ingest(eq(device), captor.capture());
        Reading reading = captor.getValue();
        assertThat(reading.getTimestamp()).isEqualTo(READ_AT);
        assertThat(reading.get(MeasurementField.PTOTAL)).isEqualByComparingTo("200.0");
        assertThat(reading.get(MeasurementField.PFAVG)).isEqualTo(new BigDecimal("0.900"));
        assertThat(reading.getValues()).hasSize(2);
    }

    @Test
    void shouldRejectParameterMissingFromRegisterMap() {
        when(accessGuard.requireDevice(ADMIN, "pm-1")).thenReturn(device);

        assertThatThrownBy(() -> handler.handle(new IngestRegisterFrameCommand(
                ADMIN, "pm-1", READ_AT, Map.of("THD_V1", new int[]{0, 0}))))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Parameter THD_V1 is not in the register map of device pm-1");

        verifyNoInteractions(ingestHandler);
        assertThat(meterRegistry.get("ems.ingest.rejected.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectMappedParameterWithoutColumn() {
        when(accessGuard.requireDevice(ADMIN, "pm-1")).thenReturn(device);

        assertThatThrownBy(() -> handler.handle(new IngestRegisterFrameCommand(
                ADMIN, "pm-1", READ_AT, Map.of("Serial", new int[]{0x0001, 0x86A0}))))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Parameter Serial is not a measurement field");
    }

    @Test
    void shouldRejectWrongRegisterCount() {
        when(accessGuard.requireDevice(ADMIN, "pm-1")).thenReturn(device);

        assertThatThrownBy(() -> handler.handle(new IngestRegisterFrameCommand(
                ADMIN, "pm-1", READ_AT, Map.of("Ptotal", new int[]{0x4348}))))
                .isInstanceOf(DecodeException.class)
                .hasMessage("FLOAT32 requires 2 register(s) but got 1");

        verifyNoInteractions(ingestHandler);
        assertThat(meterRegistry.get("ems.ingest.rejected.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectEmptyFrame() {
        when(accessGuard.requireDevice(ADMIN, "pm-1")).thenReturn(device);

        assertThatThrownBy(() -> handler.handle(new IngestRegisterFrameCommand(ADMIN, "pm-1", READ_AT, Map.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No registers provided");
    }
}
