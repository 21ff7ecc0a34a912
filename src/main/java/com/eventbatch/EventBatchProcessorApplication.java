package com.eventbatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Analytics Event Batch Processor
 *
 * Ingests analytics events, coalesces them into bounded batches and flushes
 * those batches one at a time into durable storage.
 *
 * Architecture:
 * - REST intake for single events and pre-built batches
 * - In-memory batch queue with capacity-based and timer-based flushing
 * - Single-flight drain loop (one flush pass per instance)
 * - PostgreSQL event log, Redis counters and behavior timelines
 * - Redis pub/sub notification when a batch completes
 *
 * Flush Triggers:
 * - Batch reaches capacity (100 events): flush after a short debounce
 * - Timer tick (every 30 seconds): closes the open batch and flushes
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class EventBatchProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventBatchProcessorApplication.class, args);
    }
}
