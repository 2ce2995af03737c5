package com.koni.ems.application.query;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.DataPoint;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.TimeWindow;
import com.koni.ems.domain.repository.DataPointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Query handler for ranges of device rows.
 */
@Slf4j
@Service
public class GetDataPointsQueryHandler {

    private final DeviceAccessGuard accessGuard;
    private final DataPointRepository dataPointRepository;
    private final int defaultPageSize;
    private final int maxPageSize;

    public GetDataPointsQueryHandler(
            DeviceAccessGuard accessGuard,
            DataPointRepository dataPointRepository,
            @Value("${ems.query.default-page-size:1000}") int defaultPageSize,
            @Value("${ems.query.max-page-size:10000}") int maxPageSize) {
        this.accessGuard = accessGuard;
        this.dataPointRepository = dataPointRepository;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Handles the GetDataPointsQuery.
     *
     * @param query device, window and paging
     * @return the page, possibly empty
     * @throws ValidationException if the window or paging parameters are invalid
     */
    public DataPointPage handle(GetDataPointsQuery query) {
        Device device = accessGuard.requireDevice(query.getCaller(), query.getDeviceId());

        TimeWindow window = TimeWindow.of(query.getStartTime(), query.getEndTime());
        int limit = query.getLimit() != null ? query.getLimit() : defaultPageSize;
        int offset = query.getOffset() != null ? query.getOffset() : 0;
        if (limit < 1 || limit > maxPageSize) {
            throw new ValidationException("limit must be between 1 and " + maxPageSize);
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }

        List<DataPoint> rows = dataPointRepository.findRange(device.relationName(), window, limit, offset);
        log.debug("Retrieved {} data points: deviceId={}, window={}, limit={}, offset={}",
                rows.size(), device.getId(), window, limit, offset);
        return new DataPointPage(device.getId(), rows.size(), rows);
    }
}
