package com.biai.explorer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for per-column aggregation fan-out.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "aggregationExecutor")
    public ThreadPoolTaskExecutor aggregationExecutor(AggregationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getColumnPoolSize());
        executor.setMaxPoolSize(properties.getColumnPoolSize());
        executor.setQueueCapacity(properties.getColumnQueueCapacity());
        executor.setThreadNamePrefix("aggregation-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
