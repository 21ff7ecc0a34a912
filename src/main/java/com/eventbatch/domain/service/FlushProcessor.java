package com.eventbatch.domain.service;

import com.eventbatch.domain.model.EventBatch;
import com.eventbatch.domain.model.EventWriteResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-flight drain loop over the batch queue.
 *
 * At most one drain pass runs per instance, whatever triggered it
 * (capacity, timer, manual). The guard is taken with a compare-and-set
 * before any other work and released in a finally around the whole loop.
 * A trigger that finds the guard taken does nothing: the running pass
 * keeps draining until no flushable batch is left.
 *
 * Batch Outcomes:
 * - Routine returns: COMPLETED, removed from the queue, broadcast sent
 * - Routine throws: FAILED, left in the queue, next batch continues
 *
 * Failure Handling:
 * - The guard is released even when a pass throws
 * - Error message is kept on the batch and shown by status
 * - Failed batches are not retried
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlushProcessor {

    private final BatchAccumulator accumulator;
    private final BatchProcessor batchProcessor;
    private final BatchNotifier batchNotifier;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean flushing = new AtomicBoolean(false);

    public void flush() {
        while (flushing.compareAndSet(false, true)) {
            try {
                drain();
            } finally {
                flushing.set(false);
            }

            // A batch closed after the last claim but before the release
            // would otherwise wait for the next timer tick.
            if (!accumulator.hasFlushableBatches()) {
                return;
            }
        }
        log.debug("Flush already active, trigger ignored");
    }

    public boolean isFlushing() {
        return flushing.get();
    }

    private void drain() {
        Timer.Sample sample = Timer.start(meterRegistry);
        int completed = 0;
        int failed = 0;

        Optional<EventBatch> next;
        while ((next = accumulator.claimNextPending()).isPresent()) {
            EventBatch batch = next.get();
            if (processOne(batch)) {
                completed++;
            } else {
                failed++;
            }
        }

        sample.stop(Timer.builder("batch.flush.latency").register(meterRegistry));

        if (completed + failed > 0) {
            log.info("Flush pass finished: {} completed, {} failed, {} left in queue",
                    completed, failed, accumulator.size());
        }
    }

    private boolean processOne(EventBatch batch) {
        log.debug("Processing batch {} ({} events)", batch.getId(), batch.size());
        try {
            List<EventWriteResult> results = batchProcessor.process(batch);
            accumulator.complete(batch);

            long persisted = results.stream().filter(EventWriteResult::success).count();
            log.info("Batch {} completed: {}/{} events persisted", batch.getId(), persisted, results.size());
            countBatch("completed");

        } catch (Exception e) {
            log.error("Error processing batch {}: {}", batch.getId(), e.getMessage(), e);
            accumulator.fail(batch, rootMessage(e));
            countBatch("failed");
            return false;
        }

        batchNotifier.batchProcessed(batch);
        return true;
    }

    private void countBatch(String result) {
        Counter.builder("batch.processed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
