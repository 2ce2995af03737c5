package com.koni.ems.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker guarding the streaming bus.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, events are sent
 * - OPEN: Failure threshold exceeded, publishing fails fast
 * - HALF_OPEN: Testing if the broker recovered, limited sends allowed
 */
@Configuration
@ConditionalOnProperty(name = "ems.streaming.enabled", havingValue = "true")
public class CircuitBreakerConfiguration {

    /**
     * Sliding window of 10 calls, opens at 50% failures, stays open for 30 seconds
     * and lets 3 trial calls through when half open.
     */
    @Bean
    public CircuitBreakerConfig streamingCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker streamingCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("streaming");
    }
}
