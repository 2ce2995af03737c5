package com.koni.ems.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking ingestion and storage maintenance metrics.
 */
@Slf4j
@Component
public class IngestionMetrics {

    private final Counter accepted;
    private final Counter rejected;
    private final Counter publishFailed;
    private final Counter orphansReclaimed;
    private final Timer processingTime;

    public IngestionMetrics(MeterRegistry registry) {
        this.accepted = Counter.builder("ems.ingest.accepted.total")
                .description("Total readings stored")
                .register(registry);

        this.rejected = Counter.builder("ems.ingest.rejected.total")
                .description("Total readings rejected by validation")
                .register(registry);

        this.publishFailed = Counter.builder("ems.stream.publish.failed.total")
                .description("Total stored readings that could not be republished")
                .register(registry);

        this.orphansReclaimed = Counter.builder("ems.orphans.reclaimed.total")
                .description("Total device relations dropped because no device owned them")
                .register(registry);

        this.processingTime = Timer.builder("ems.ingest.processing.time")
                .description("Time to validate and store a reading")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAccepted() {
        accepted.increment();
    }

    public void recordRejected() {
        rejected.increment();
        log.debug("Rejected reading counter incremented");
    }

    public void recordPublishFailed() {
        publishFailed.increment();
        log.debug("Publish failure counter incremented");
    }

    public void recordOrphansReclaimed(int count) {
        orphansReclaimed.increment(count);
    }

    /**
     * Record the processing time for an ingestion.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }
}
