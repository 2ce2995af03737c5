package com.koni.ems.infrastructure.observability;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator for the streaming bus, registered only while streaming is enabled.
 *
 * <p>Reports the cluster, the number of per-device topics carrying the configured prefix
 * and the state of the publish circuit breaker. Streaming is best-effort, so an open
 * circuit is reported as a detail and does not turn the indicator down; an unreachable
 * cluster does.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ems.streaming.enabled", havingValue = "true")
public class KafkaHealthIndicator implements HealthIndicator {

    static final long TIMEOUT_SECONDS = 5;

    private final KafkaAdmin kafkaAdmin;
    private final CircuitBreaker circuitBreaker;
    private final String topicPrefix;

    public KafkaHealthIndicator(
            KafkaAdmin kafkaAdmin,
            CircuitBreaker streamingCircuitBreaker,
            @Value("${ems.streaming.topic-prefix:device-data-}") String topicPrefix) {
        this.kafkaAdmin = kafkaAdmin;
        this.circuitBreaker = streamingCircuitBreaker;
        this.topicPrefix = topicPrefix;
    }

    @Override
    public Health health() {
        String circuitState = circuitBreaker.getState().name();
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            DescribeClusterResult cluster = adminClient.describeCluster();
            String clusterId = cluster.clusterId().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            int nodeCount = cluster.nodes().get(TIMEOUT_SECONDS, TimeUnit.SECONDS).size();

            Set<String> topics = adminClient.listTopics().names().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            long deviceTopics = topics.stream().filter(topic -> topic.startsWith(topicPrefix)).count();

            log.debug("Streaming bus health check passed: clusterId={}, nodes={}, deviceTopics={}, circuit={}",
                    clusterId, nodeCount, deviceTopics, circuitState);

            return Health.up()
                    .withDetail("clusterId", clusterId)
                    .withDetail("nodeCount", nodeCount)
                    .withDetail("topicPrefix", topicPrefix)
                    .withDetail("deviceTopics", deviceTopics)
                    .withDetail("circuitBreaker", circuitState)
                    .build();

        } catch (Exception e) {
            log.error("Streaming bus health check failed: circuit={}", circuitState, e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .withDetail("topicPrefix", topicPrefix)
                    .withDetail("circuitBreaker", circuitState)
                    .build();
        }
    }
}
