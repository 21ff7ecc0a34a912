package com.eventbatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Beans shared by the batching pipeline.
 *
 * The per-event writes of a flush run on their own pool, separate from
 * the scheduler threads that run the timer trigger.
 */
@Configuration
public class BatchProcessorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "eventWriteExecutor")
    public ThreadPoolTaskExecutor eventWriteExecutor(BatchProcessorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.writerThreads());
        executor.setMaxPoolSize(properties.writerThreads());
        executor.setQueueCapacity(properties.capacity() * 4);
        executor.setThreadNamePrefix("event-write-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
