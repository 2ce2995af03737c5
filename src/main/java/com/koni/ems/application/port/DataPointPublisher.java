package com.koni.ems.application.port;

import com.koni.ems.domain.event.DataPointRecorded;

/**
 * Port interface for republishing stored data points to the streaming bus.
 * Implemented by the Kafka adapter, or by a no-op adapter when streaming is disabled.
 */
public interface DataPointPublisher {

    /**
     * Publishes a DataPointRecorded event to the device's topic.
     *
     * @param event the event to publish
     * @throws com.koni.ems.domain.exception.StreamingUnavailableException if the broker cannot be reached
     */
    void publish(DataPointRecorded event);

    /**
     * @return false when publishing is switched off and {@link #publish} does nothing
     */
    boolean isEnabled();
}
