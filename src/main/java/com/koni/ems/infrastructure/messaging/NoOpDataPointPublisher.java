package com.koni.ems.infrastructure.messaging;

import com.koni.ems.application.port.DataPointPublisher;
import com.koni.ems.domain.event.DataPointRecorded;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * DataPointPublisher used while streaming is switched off. Every publish succeeds without effect.
 */
@Service
@ConditionalOnProperty(name = "ems.streaming.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpDataPointPublisher implements DataPointPublisher {

    @Override
    public void publish(DataPointRecorded event) {
        // streaming disabled
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
