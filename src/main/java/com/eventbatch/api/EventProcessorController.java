package com.eventbatch.api;

import com.eventbatch.domain.exception.ValidationException;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.BatchReceipt;
import com.eventbatch.domain.model.BatchStatusResponse;
import com.eventbatch.domain.model.BehaviorRecord;
import com.eventbatch.domain.model.EventReceipt;
import com.eventbatch.domain.service.BehaviorTracker;
import com.eventbatch.domain.service.EventIntakeService;
import com.eventbatch.domain.service.MetricsAggregator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for the event batch processor.
 *
 * Endpoints:
 * - POST /api/v1/event-processor/process - Accept one event
 * - POST /api/v1/event-processor/batch - Accept an array of events as one batch
 * - GET /api/v1/event-processor/status - Queue and flush state
 * - GET /api/v1/event-processor/counters/{eventName} - Current counter value
 * - GET /api/v1/event-processor/behavior/{userId} - User behavior window
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/event-processor")
@RequiredArgsConstructor
public class EventProcessorController {

    private static final TypeReference<List<AnalyticsEvent>> EVENT_LIST = new TypeReference<>() {};

    private final EventIntakeService intakeService;
    private final MetricsAggregator metricsAggregator;
    private final BehaviorTracker behaviorTracker;
    private final ObjectMapper objectMapper;

    /**
     * Accept one event.
     *
     * Response:
     * {
     *   "success": true,
     *   "eventId": "evt_...",
     *   "batchId": "batch_...",
     *   "message": "Event added to processing queue"
     * }
     */
    @PostMapping("/process")
    public ResponseEntity<Map<String, Object>> process(@RequestBody AnalyticsEvent event) {
        EventReceipt receipt = intakeService.submitEvent(event);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("eventId", receipt.eventId());
        body.put("batchId", receipt.batchId());
        body.put("message", "Event added to processing queue");
        return ResponseEntity.ok(body);
    }

    /**
     * Accept a batch of events.
     *
     * Request body:
     * {
     *   "events": [ { "eventName": "...", "timestampMs": 0, ... }, ... ]
     * }
     *
     * Response:
     * {
     *   "success": true,
     *   "batchId": "batch_...",
     *   "eventCount": 5
     * }
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> batch(@RequestBody JsonNode payload) {
        List<AnalyticsEvent> events = readEvents(payload);

        log.info("Batch submitted: {} events", events.size());

        BatchReceipt receipt = intakeService.submitBatch(events);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("batchId", receipt.batchId());
        body.put("eventCount", receipt.eventCount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status")
    public ResponseEntity<BatchStatusResponse> status() {
        return ResponseEntity.ok(intakeService.getStatus());
    }

    @GetMapping("/counters/{eventName}")
    public ResponseEntity<Map<String, Object>> counter(@PathVariable String eventName) {
        return ResponseEntity.ok(Map.of(
                "eventName", eventName,
                "count", metricsAggregator.currentCount(eventName)));
    }

    @GetMapping("/behavior/{userId}")
    public ResponseEntity<BehaviorRecord> behavior(@PathVariable String userId) {
        return behaviorTracker.find(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private List<AnalyticsEvent> readEvents(JsonNode payload) {
        JsonNode events = payload != null ? payload.get("events") : null;
        if (events == null || !events.isArray()) {
            throw new ValidationException("Events must be an array");
        }
        try {
            return objectMapper.convertValue(events, EVENT_LIST);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed event in batch: " + e.getMessage());
        }
    }
}
