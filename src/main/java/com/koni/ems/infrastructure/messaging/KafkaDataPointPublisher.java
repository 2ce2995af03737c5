package com.koni.ems.infrastructure.messaging;

import com.koni.ems.application.port.DataPointPublisher;
import com.koni.ems.domain.event.DataPointRecorded;
import com.koni.ems.domain.exception.StreamingUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Kafka implementation of the DataPointPublisher port with Circuit Breaker protection.
 *
 * Features:
 * - One topic per device, {@code <prefix><deviceId>}
 * - Device id as record key
 * - Fails fast while the circuit is open
 * - Logs circuit breaker state changes for observability
 *
 * There is no fallback store: a failed publish surfaces as
 * {@link StreamingUnavailableException} and the caller decides what to do with it.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "ems.streaming.enabled", havingValue = "true")
public class KafkaDataPointPublisher implements DataPointPublisher {

    private static final Pattern ILLEGAL_TOPIC_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final int MAX_TOPIC_LENGTH = 249;
    private static final int TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, DataPointRecorded> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String topicPrefix;

    public KafkaDataPointPublisher(
            KafkaTemplate<String, DataPointRecorded> kafkaTemplate,
            CircuitBreaker streamingCircuitBreaker,
            @Value("${ems.streaming.topic-prefix:device-data-}") String topicPrefix) {
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreaker = streamingCircuitBreaker;
        this.topicPrefix = topicPrefix;

        registerCircuitBreakerEventListeners();
    }

    /**
     * Publishes a DataPointRecorded event to the topic of its device.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     * @throws StreamingUnavailableException if the circuit is open or the send fails
     */
    @Override
    public void publish(DataPointRecorded event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        Supplier<SendResult<String, DataPointRecorded>> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker, () -> send(event));
        try {
            SendResult<String, DataPointRecorded> result = decorated.get();
            log.debug("Published data point: topic={}, partition={}, offset={}, deviceId={}",
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getDeviceId());
        } catch (CallNotPermittedException e) {
            throw new StreamingUnavailableException("Streaming circuit is open", e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    /**
     * Topic name of a device. Characters Kafka does not allow in topic names become {@code _}.
     */
    public String topicFor(String deviceId) {
        String topic = ILLEGAL_TOPIC_CHARS.matcher(topicPrefix + deviceId).replaceAll("_");
        return topic.length() > MAX_TOPIC_LENGTH ? topic.substring(0, MAX_TOPIC_LENGTH) : topic;
    }

    private SendResult<String, DataPointRecorded> send(DataPointRecorded event) {
        String topic = topicFor(event.getDeviceId());
        try {
            CompletableFuture<SendResult<String, DataPointRecorded>> future =
                    kafkaTemplate.send(topic, event.getDeviceId(), event);
            return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamingUnavailableException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new StreamingUnavailableException("Failed to publish to " + topic + ": " + e.getMessage(), e);
        }
    }

    private void registerCircuitBreakerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn(
                        "Circuit breaker state transition: {} -> {} (failure rate: {}%)",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onCallNotPermitted(event -> log.debug("Circuit breaker call not permitted (circuit is OPEN)"));
    }
}
