package com.koni.ems.infrastructure.messaging;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executor for stream publication.
 * A full queue rejects new work instead of blocking the request thread.
 */
@Configuration
public class StreamingExecutorConfig {

    @Value("${ems.streaming.executor.core-size:2}")
    private int coreSize;

    @Value("${ems.streaming.executor.max-size:4}")
    private int maxSize;

    @Value("${ems.streaming.executor.queue-capacity:1000}")
    private int queueCapacity;

    @Bean
    public ThreadPoolTaskExecutor streamPublishExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("stream-publish-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
