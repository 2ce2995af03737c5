package com.koni.ems.application.query;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.model.DataPointStats;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.TimeWindow;
import com.koni.ems.domain.repository.DataPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Query handler for device aggregates. An empty window yields a count of zero and
 * null aggregates rather than an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetDataPointStatsQueryHandler {

    private final DeviceAccessGuard accessGuard;
    private final DataPointRepository dataPointRepository;

    public DataPointStats handle(GetDataPointStatsQuery query) {
        Device device = accessGuard.requireDevice(query.getCaller(), query.getDeviceId());
        TimeWindow window = TimeWindow.of(query.getStartTime(), query.getEndTime());

        DataPointStats stats = dataPointRepository.stats(device.relationName(), window);
        log.debug("Computed stats: deviceId={}, window={}, count={}", device.getId(), window, stats.getCount());
        return stats;
    }
}
