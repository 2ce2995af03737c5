package com.koni.ems.application.command;

import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.DecodeException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.domain.model.MeasurementField;
import com.koni.ems.domain.model.Reading;
import com.koni.ems.domain.model.RegisterMapping;
import com.koni.ems.domain.register.RegisterDecoder;
import com.koni.ems.infrastructure.observability.IngestionMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Command handler decoding register frames with the device register map and storing
 * the result through {@link IngestDataPointCommandHandler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestRegisterFrameCommandHandler {

    private final DeviceAccessGuard accessGuard;
    private final IngestDataPointCommandHandler ingestHandler;
    private final IngestionMetrics metrics;

    @Observed(name = "command.handler", contextualName = "ingest-register-frame")
    public IngestResult handle(IngestRegisterFrameCommand command) {
        Device device = accessGuard.requireDevice(command.getCaller(), command.getDeviceId());

        Reading reading;
        try {
            reading = new Reading(command.getTimestamp(), decode(device, command.getRegisters()));
        } catch (ValidationException e) {
            metrics.recordRejected();
            throw e;
        }
        log.debug("Register frame decoded: deviceId={}, reading={}", device.getId(), reading);
        return ingestHandler.ingest(device, reading);
    }

    private Map<MeasurementField, BigDecimal> decode(Device device, Map<String, int[]> registers) {
        if (registers == null || registers.isEmpty()) {
            throw new ValidationException("No registers provided");
        }

        Map<MeasurementField, BigDecimal> values = new EnumMap<>(MeasurementField.class);
        for (Map.Entry<String, int[]> entry : registers.entrySet()) {
            String parameter = entry.getKey();
            RegisterMapping mapping = device.mappingFor(parameter)
                    .orElseThrow(() -> new ValidationException(
                            "Parameter " + parameter + " is not in the register map of device " + device.getId()));
            MeasurementField field = MeasurementField.fromFieldName(parameter)
                    .orElseThrow(() -> new ValidationException(
                            "Parameter " + parameter + " is not a measurement field"));
            if (!mapping.getDataType().isNumeric()) {
                throw new DecodeException("Parameter " + parameter + " is mapped to non-numeric type "
                        + mapping.getDataType().getWireName());
            }
            values.put(field, RegisterDecoder.decode(entry.getValue(), mapping.getDataType()).toDecimal());
        }
        return values;
    }
}
