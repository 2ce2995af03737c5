package com.koni.ems.application.service;

import com.koni.ems.domain.exception.StorageNotReadyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether storage initialization has finished.
 * Requests touching device data are refused until it has.
 */
@Slf4j
@Component
public class StorageReadiness {

    private final AtomicBoolean ready = new AtomicBoolean(false);

    public boolean isReady() {
        return ready.get();
    }

    public void markReady() {
        if (ready.compareAndSet(false, true)) {
            log.info("Storage initialization complete, accepting requests");
        }
    }

    /**
     * @throws StorageNotReadyException while initialization is still running
     */
    public void requireReady() {
        if (!ready.get()) {
            throw new StorageNotReadyException("Storage is initializing, retry shortly");
        }
    }
}
