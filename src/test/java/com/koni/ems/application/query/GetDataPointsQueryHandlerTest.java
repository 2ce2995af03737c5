package com.koni.ems.application.query;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DataPoint;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.MeasurementField;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.TimeWindow;
import com.koni.ems.domain.repository.DataPointRepository;
import com.koni.ems.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GetDataPointsQueryHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetDataPointsQueryHandlerTest {

    private static final Caller USER = new Caller("u-1", "user");
    private static final RelationName RELATION = RelationName.forDevice("pm-1");

    @Mock
    private DeviceAccessGuard accessGuard;

    @Mock
    private DataPointRepository dataPointRepository;

    private GetDataPointsQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GetDataPointsQueryHandler(accessGuard, dataPointRepository, 1000, 10000);
        lenient().when(accessGuard.requireDevice(USER, "pm-1")).thenReturn(Device.builder()
                .id("pm-1")
                .name("Feeder")
                .type("PM5320")
                .ipAddress("10.0.0.2")
                .status(DeviceStatus.ONLINE)
                .registerMap(List.of())
                .build());
    }

    @Test
    void shouldReturnRowsOfWindowWithDefaultPaging() {
        // Given
        Instant start = Instant.parse("2025-01-31T00:00:00Z");
        Instant end = Instant.parse("2025-01-31T23:59:59Z");
        DataPoint row = new DataPoint(3L, Instant.parse("2025-01-31T13:00:00Z"),
                Map.of(MeasurementField.PTOTAL, new BigDecimal("10.500")));
        when(dataPointRepository.findRange(RELATION, TimeWindow.of(start, end), 1000, 0)).thenReturn(List.of(row));

        // When
        DataPointPage page = handler.handle(new GetDataPointsQuery(USER, "pm-1", start, end, null, null));

        // Then
        assertThat(page.getDeviceId()).isEqualTo("pm-1");
        assertThat(page.getCount()).isEqualTo(1);
        assertThat(page.getData()).containsExactly(row);
        assertThat(row.getValues()).containsEntry("VR", null).containsEntry("Ptotal", new BigDecimal("10.500"));
    }

    @Test
    void shouldAcceptEqualBounds() {
        Instant instant = Instant.parse("2025-01-31T13:00:00Z");
        when(dataPointRepository.findRange(RELATION, TimeWindow.of(instant, instant), 10, 5)).thenReturn(List.of());

        DataPointPage page = handler.handle(new GetDataPointsQuery(USER, "pm-1", instant, instant, 10, 5));

        assertThat(page.getCount()).isZero();
        assertThat(page.getData()).isEmpty();
    }

    @Test
    void shouldRejectInvertedWindow() {
        Instant start = Instant.parse("2025-02-01T00:00:00Z");
        Instant end = Instant.parse("2025-01-01T00:00:00Z");

        assertThatThrownBy(() -> handler.handle(new GetDataPointsQuery(USER, "pm-1", start, end, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("startTime must not be after endTime");

        verifyNoInteractions(dataPointRepository);
    }

    @Test
    void shouldRejectOutOfRangePaging() {
        assertThatThrownBy(() -> handler.handle(new GetDataPointsQuery(USER, "pm-1", null, null, 0, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("limit must be between 1 and 10000");
        assertThatThrownBy(() -> handler.handle(new GetDataPointsQuery(USER, "pm-1", null, null, 10001, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> handler.handle(new GetDataPointsQuery(USER, "pm-1", null, null, 10, -1)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("offset must not be negative");

        verify(dataPointRepository, never()).findRange(any(), any(), anyInt(), anyInt());
    }
}
