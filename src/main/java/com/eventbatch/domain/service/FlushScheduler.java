package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides when a flush pass starts.
 *
 * Triggers:
 * - Eager: a batch filled up. Flush runs after a short debounce so a burst
 *   of submissions coalesces into one pass. Triggers during the debounce
 *   window reuse the already scheduled run.
 * - Timer: every flush interval. Closes the open batch (if it has events)
 *   so low-volume traffic is flushed within one interval.
 *
 * Both go through {@link FlushProcessor#flush()} and its single-flight guard.
 *
 * Failure Handling:
 * - Scheduler rejects the eager run (shutdown, saturation): logged, the
 *   debounce flag is cleared and the timer picks the batch up
 */
@Slf4j
@Component
public class FlushScheduler {

    private final FlushProcessor flushProcessor;
    private final BatchAccumulator accumulator;
    private final TaskScheduler taskScheduler;
    private final Duration debounce;
    private final Clock clock;

    private final AtomicBoolean eagerScheduled = new AtomicBoolean(false);

    public FlushScheduler(FlushProcessor flushProcessor,
                          BatchAccumulator accumulator,
                          TaskScheduler taskScheduler,
                          BatchProcessorProperties properties,
                          Clock clock) {
        this.flushProcessor = flushProcessor;
        this.accumulator = accumulator;
        this.taskScheduler = taskScheduler;
        this.debounce = Duration.ofMillis(properties.debounceMs());
        this.clock = clock;
    }

    public void triggerEager() {
        if (!eagerScheduled.compareAndSet(false, true)) {
            log.debug("Eager flush already scheduled");
            return;
        }

        try {
            taskScheduler.schedule(() -> {
                eagerScheduled.set(false);
                flushProcessor.flush();
            }, clock.instant().plus(debounce));
        } catch (RuntimeException e) {
            // The next trigger must be able to schedule again; the timer still covers this batch
            eagerScheduled.set(false);
            log.warn("Could not schedule eager flush: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${app.batch.flush-interval-ms:30000}",
            initialDelayString = "${app.batch.flush-interval-ms:30000}")
    public void onTimerTick() {
        accumulator.closeOpenBatch();

        if (accumulator.hasFlushableBatches()) {
            log.debug("Timer tick: flushing {} queued batches", accumulator.size());
            flushProcessor.flush();
        }
    }
}
