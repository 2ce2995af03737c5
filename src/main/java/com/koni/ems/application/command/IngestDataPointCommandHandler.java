package com.koni.ems.application.command;

import com.koni.ems.application.service.DataPointStreamDispatcher;
import com.koni.ems.application.service.DeviceAccessGuard;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.domain.model.Reading;
import com.koni.ems.domain.repository.DataPointRepository;
import com.koni.ems.infrastructure.observability.IngestionMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Command handler for storing device readings.
 *
 * Responsibilities:
 * - Authorize the caller and resolve the device
 * - Validate the reading against the known measurement fields
 * - Insert one row into the device relation
 * - Hand the committed row to the streaming bus
 *
 * The insert runs outside a surrounding transaction and commits on its own, so the
 * stream dispatch only ever sees rows that are durable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestDataPointCommandHandler {

    private final DeviceAccessGuard accessGuard;
    private final DataPointRepository dataPointRepository;
    private final DataPointStreamDispatcher streamDispatcher;
    private final IngestionMetrics metrics;

    /**
     * Handles the IngestDataPointCommand.
     *
     * @param command the reading to store
     * @return the generated row id and stored timestamp
     * @throws ValidationException if the payload is not a valid reading
     * @throws com.koni.ems.domain.exception.PermissionDeniedException if the caller may not write to the device
     * @throws com.koni.ems.domain.exception.NotFoundException if the device is not registered
     */
    @Observed(name = "command.handler", contextualName = "ingest-data-point")
    public IngestResult handle(IngestDataPointCommand command) {
        log.debug("Handling IngestDataPointCommand: deviceId={}, fields={}",
                command.getDeviceId(), command.getPayload() == null ? null : command.getPayload().keySet());

        Device device = accessGuard.requireDevice(command.getCaller(), command.getDeviceId());

        Reading reading;
        try {
            reading = Reading.fromPayload(command.getPayload());
        } catch (ValidationException e) {
            metrics.recordRejected();
            throw e;
        }
        return ingest(device, reading);
    }

    /**
     * Stores an already validated reading of a resolved device.
     */
    public IngestResult ingest(Device device, Reading reading) {
        return metrics.recordProcessingTime(() -> {
            IngestResult result;
            try {
                result = dataPointRepository.insert(device.relationName(), reading);
            } catch (ValidationException e) {
                metrics.recordRejected();
                throw e;
            }
            metrics.recordAccepted();
            log.info("Data point saved: deviceId={}, id={}, timestamp={}, fields={}",
                    device.getId(), result.getId(), result.getTimestamp(), reading.getValues().size());

            streamDispatcher.dispatch(device.getId(), reading, result);
            return result;
        });
    }
}
