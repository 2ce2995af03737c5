package com.koni.ems.infrastructure.messaging;

import com.koni.ems.tags.UnitTest;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class KafkaProducerConfigTest {

    @Test
    void shouldUseIdempotentProducerForAllAcks() {
        Map<String, Object> props = KafkaProducerConfig.producerProperties("broker:9092", "all", 3);

        assertThat(props)
                .containsEntry(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, "broker:9092")
                .containsEntry(ProducerConfig.ACKS_CONFIG, "all")
                .containsEntry(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true)
                .containsEntry(ProducerConfig.RETRIES_CONFIG, 3);
    }

    @Test
    void shouldDisableRetriesForLeaderAcks() {
        Map<String, Object> props = KafkaProducerConfig.producerProperties("broker:9092", "1", 3);

        assertThat(props)
                .containsEntry(ProducerConfig.ACKS_CONFIG, "1")
                .containsEntry(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false)
                .containsEntry(ProducerConfig.RETRIES_CONFIG, 0)
                .containsEntry(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
    }

    @Test
    void shouldSerializeEventsAsPlainJson() {
        Map<String, Object> props = KafkaProducerConfig.producerProperties("broker:9092", "1", 0);

        assertThat(props)
                .containsEntry(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class)
                .containsEntry(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
    }
}
