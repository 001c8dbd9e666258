package com.viral.prediction.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Leaf work only: feature sub-extractions and bounded runtime calls.
     * Tasks on this pool never wait on other tasks of the same pool.
     */
    @Bean
    public Executor predictionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("prediction-");
        executor.initialize();
        return executor;
    }

    /**
     * Batch items and outcome recording. These block on {@link #predictionExecutor()} work.
     */
    @Bean
    public Executor batchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("prediction-batch-");
        executor.initialize();
        return executor;
    }
}
