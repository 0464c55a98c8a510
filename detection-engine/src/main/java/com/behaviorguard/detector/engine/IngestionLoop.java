package com.behaviorguard.detector.engine;

import com.behaviorguard.detector.config.IngestionConfig;
import com.behaviorguard.detector.event.EventSource;
import com.behaviorguard.detector.event.EventSourceException;
import com.behaviorguard.detector.event.RawEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pulls batches from the {@link EventSource} and hands each record to the
 * {@link EventProcessor}.
 *
 * <p>
 * Waits on the source are bounded by the poll timeout. When the source is
 * unavailable the loop backs off for the retry delay and tries again; it never
 * gives up.
 * </p>
 */
@Component
public class IngestionLoop {

    private static final Logger log = LoggerFactory.getLogger(IngestionLoop.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    /** Full batches drained back to back before yielding to the schedule. */
    private static final int MAX_BATCHES_PER_RUN = 64;

    private final EventSource source;
    private final EventProcessor processor;
    private final IngestionConfig config;
    private final MeterRegistry meterRegistry;

    private ScheduledExecutorService executor;
    private volatile boolean running;
    private volatile long backoffUntilNanos;

    private Counter eventsReceived;
    private Counter sourceErrors;

    public IngestionLoop(EventSource source, EventProcessor processor, IngestionConfig config,
            MeterRegistry meterRegistry) {
        this.source = source;
        this.processor = processor;
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        eventsReceived = Counter.builder("behaviorguard.ingestion.received")
                .description("Raw records pulled from the event source")
                .register(meterRegistry);
        sourceErrors = Counter.builder("behaviorguard.ingestion.source_errors")
                .description("Event source unavailability episodes")
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        running = true;
        executor = Actors.singleThread("event-ingestion");
        executor.scheduleWithFixedDelay(this::runSafely, 0, config.getIdleDelayMs(), TimeUnit.MILLISECONDS);
        log.info("Ingestion started from {} (batch={}, pollTimeout={} ms)",
                source.describe(), config.getBatchSize(), config.getPollTimeoutMs());
    }

    public synchronized void stop() {
        running = false;
        Actors.shutdown(executor, "event-ingestion", SHUTDOWN_GRACE);
        executor = null;
    }

    private void runSafely() {
        try {
            for (int i = 0; i < MAX_BATCHES_PER_RUN && running; i++) {
                if (pollOnce() < config.getBatchSize()) {
                    break;
                }
            }
        } catch (Exception e) {
            log.error("Ingestion cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Poll one batch and process it.
     *
     * @return number of records received, 0 while backing off
     */
    public int pollOnce() {
        if (isBackingOff()) {
            return 0;
        }
        List<RawEvent> batch;
        try {
            batch = source.poll(config.getBatchSize(), config.getPollTimeout());
        } catch (EventSourceException e) {
            sourceErrors.increment();
            backoffUntilNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getRetryDelayMs());
            log.warn("Event source {} unavailable, retrying in {} ms: {}",
                    source.describe(), config.getRetryDelayMs(), e.getMessage());
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }

        eventsReceived.increment(batch.size());
        for (RawEvent raw : batch) {
            processor.process(raw);
        }
        return batch.size();
    }

    public boolean isBackingOff() {
        return backoffUntilNanos != 0 && System.nanoTime() - backoffUntilNanos < 0;
    }
}
