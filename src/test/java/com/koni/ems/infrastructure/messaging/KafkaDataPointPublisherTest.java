package com.koni.ems.infrastructure.messaging;

import com.koni.ems.domain.event.DataPointRecorded;
import com.koni.ems.domain.exception.StreamingUnavailableException;
import com.koni.ems.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KafkaDataPointPublisher.
 * Tests topic naming, partition key usage and failure handling.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class KafkaDataPointPublisherTest {

    private static final String PREFIX = "device-data-";

    @Mock
    private KafkaTemplate<String, DataPointRecorded> kafkaTemplate;

    private CircuitBreaker circuitBreaker;
    private KafkaDataPointPublisher publisher;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("test");
        publisher = new KafkaDataPointPublisher(kafkaTemplate, circuitBreaker, PREFIX);
    }

    @Test
    void shouldPublishToDeviceTopicKeyedByDevice() {
        // Given
        DataPointRecorded event = event("pm-1");
        String topic = PREFIX + "pm-1";
        ProducerRecord<String, DataPointRecorded> producerRecord = new ProducerRecord<>(topic, "pm-1", event);
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0);
        when(kafkaTemplate.send(topic, "pm-1", event))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(producerRecord, metadata)));

        // When
        publisher.publish(event);

        // Then
        verify(kafkaTemplate).send(eq(topic), eq("pm-1"), eq(event));
    }

    @Test
    void shouldWrapBrokerFailure() {
        // Given
        DataPointRecorded event = event("pm-1");
        when(kafkaTemplate.send(anyString(), anyString(), any(DataPointRecorded.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // When / Then
        assertThatThrownBy(() -> publisher.publish(event))
                .isInstanceOf(StreamingUnavailableException.class)
                .hasMessageContaining("device-data-pm-1");
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(1);
    }

    @Test
    void shouldFailFastWhenCircuitIsOpen() {
        // Given
        circuitBreaker.transitionToOpenState();

        // When / Then
        assertThatThrownBy(() -> publisher.publish(event("pm-1")))
                .isInstanceOf(StreamingUnavailableException.class)
                .hasMessage("Streaming circuit is open");
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void shouldRejectNullEvent() {
        assertThatThrownBy(() -> publisher.publish(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSanitizeTopicNames() {
        assertThat(publisher.topicFor("Meter A/1")).isEqualTo("device-data-Meter_A_1");
        assertThat(publisher.topicFor("pm.1_x-2")).isEqualTo("device-data-pm.1_x-2");
        assertThat(publisher.topicFor("x".repeat(300))).hasSize(249);
    }

    @Test
    void shouldReportEnabled() {
        assertThat(publisher.isEnabled()).isTrue();
    }

    private static DataPointRecorded event(String deviceId) {
        return new DataPointRecorded(UUID.randomUUID(), deviceId, 1L,
                Instant.parse("2025-01-31T13:00:00Z"), Instant.now(), Map.of("Ptotal", new BigDecimal("10.5")));
    }
}
