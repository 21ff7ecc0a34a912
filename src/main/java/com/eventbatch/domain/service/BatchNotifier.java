package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import com.eventbatch.domain.model.EventBatch;
import com.eventbatch.domain.port.RealtimeNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort "batch_processed" broadcast for realtime dashboards.
 */
@Slf4j
@Service
public class BatchNotifier {

    private final RealtimeNotifier realtimeNotifier;
    private final String channel;
    private final Clock clock;

    public BatchNotifier(RealtimeNotifier realtimeNotifier, BatchProcessorProperties properties, Clock clock) {
        this.realtimeNotifier = realtimeNotifier;
        this.channel = properties.notificationChannel();
        this.clock = clock;
    }

    public void batchProcessed(EventBatch batch) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "batch_processed");
        message.put("batchId", batch.getId());
        message.put("eventCount", batch.size());
        message.put("timestamp", clock.millis());

        try {
            realtimeNotifier.broadcast(channel, message);
        } catch (Exception e) {
            // Never affects the batch
            log.warn("Error notifying realtime analytics for batch {}: {}", batch.getId(), e.getMessage());
        }
    }
}
