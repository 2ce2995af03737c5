package com.koni.ems.application.service;

import com.koni.ems.application.port.DataPointPublisher;
import com.koni.ems.domain.event.DataPointRecorded;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.domain.model.Reading;
import com.koni.ems.infrastructure.observability.IngestionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Hands committed readings to the streaming bus without blocking the caller.
 * Publishing is best-effort: a full queue or a failed send is logged and counted,
 * the stored row is never affected.
 */
@Slf4j
@Service
public class DataPointStreamDispatcher {

    private final DataPointPublisher publisher;
    private final TaskExecutor executor;
    private final IngestionMetrics metrics;

    public DataPointStreamDispatcher(
            DataPointPublisher publisher,
            @Qualifier("streamPublishExecutor") TaskExecutor executor,
            IngestionMetrics metrics) {
        this.publisher = publisher;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Schedules publication of a stored reading.
     *
     * @param deviceId the device the reading belongs to
     * @param reading  the reading as validated
     * @param stored   id and timestamp of the committed row
     */
    public void dispatch(String deviceId, Reading reading, IngestResult stored) {
        if (!publisher.isEnabled()) {
            return;
        }

        DataPointRecorded event = new DataPointRecorded(
                UUID.randomUUID(),
                deviceId,
                stored.getId(),
                stored.getTimestamp(),
                Instant.now(),
                reading.toFieldMap()
        );

        try {
            executor.execute(() -> publish(event));
        } catch (TaskRejectedException e) {
            metrics.recordPublishFailed();
            log.warn("Stream publish queue full, dropping event: deviceId={}, rowId={}",
                    deviceId, stored.getId());
        }
    }

    private void publish(DataPointRecorded event) {
        try {
            publisher.publish(event);
            log.debug("DataPointRecorded event published: eventId={}, deviceId={}",
                    event.getEventId(), event.getDeviceId());
        } catch (RuntimeException e) {
            metrics.recordPublishFailed();
            log.warn("Failed to publish DataPointRecorded event: deviceId={}, rowId={}, error={}",
                    event.getDeviceId(), event.getRowId(), e.getMessage());
        }
    }
}
