package com.apelier.aiengine.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for gallery pipeline runs. Each run occupies one thread for its whole duration;
 * the pool size bounds how many galleries are processed at the same time.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor(
            @Value("${app.executor.core-pool-size:2}") int corePoolSize,
            @Value("${app.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${app.executor.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("pipeline-");
        executor.initialize();
        return executor;
    }
}
