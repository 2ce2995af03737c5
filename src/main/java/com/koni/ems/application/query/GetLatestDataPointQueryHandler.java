package com.koni.ems.application.query;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.model.DataPoint;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.repository.DataPointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GetLatestDataPointQueryHandler {

    private final DeviceAccessGuard accessGuard;
    private final DataPointRepository dataPointRepository;

    /**
     * @throws NotFoundException if the device has no rows yet
     */
    public DataPoint handle(GetLatestDataPointQuery query) {
        Device device = accessGuard.requireDevice(query.getCaller(), query.getDeviceId());
        return dataPointRepository.findLatest(device.relationName())
                .orElseThrow(() -> new NotFoundException("No data points found"));
    }
}
