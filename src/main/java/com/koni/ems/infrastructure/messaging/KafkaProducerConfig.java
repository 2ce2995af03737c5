package com.koni.ems.infrastructure.messaging;

import com.koni.ems.domain.event.DataPointRecorded;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer configuration for republishing DataPointRecorded events.
 *
 * Configuration features:
 * - JSON serialization for event payloads, without type headers
 * - Leader-only acknowledgement by default ({@code acks=1})
 * - No producer-side duplicates: with {@code acks=1} the client cannot be idempotent,
 *   so retries are switched off and delivery is at-most-once; with {@code acks=all}
 *   idempotence is enabled instead
 */
@Configuration
@ConditionalOnProperty(name = "ems.streaming.enabled", havingValue = "true")
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${ems.streaming.acks:1}")
    private String acks;

    @Value("${ems.streaming.retries:3}")
    private Integer retries;

    /**
     * Creates a ProducerFactory for DataPointRecorded events.
     */
    @Bean
    public ProducerFactory<String, DataPointRecorded> producerFactory() {
        return new DefaultKafkaProducerFactory<>(producerProperties(bootstrapServers, acks, retries));
    }

    @Bean
    public KafkaTemplate<String, DataPointRecorded> kafkaTemplate() {
        return new KafkaTemplate<>(producerFactory());
    }

    static Map<String, Object> producerProperties(String bootstrapServers, String acks, int retries) {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        if ("all".equalsIgnoreCase(acks) || "-1".equals(acks)) {
            configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
            configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        } else {
            configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false);
            configProps.put(ProducerConfig.RETRIES_CONFIG, 0);
            configProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
        }
        return configProps;
    }
}
