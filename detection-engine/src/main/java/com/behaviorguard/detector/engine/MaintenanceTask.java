package com.behaviorguard.detector.engine;

import com.behaviorguard.detector.config.EngineConfig;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Low-frequency reclamation actor: evicts stale records and detected records
 * past their audit grace period, and decays the score of cleared records.
 */
@Component
public class MaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceTask.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final EngineConfig config;
    private final ProcessBehaviorStore store;
    private final MeterRegistry meterRegistry;

    private ScheduledExecutorService executor;

    private Counter staleEvictions;
    private Counter positiveEvictions;

    public MaintenanceTask(EngineConfig config, ProcessBehaviorStore store, MeterRegistry meterRegistry) {
        this.config = config;
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        staleEvictions = Counter.builder("behaviorguard.store.evictions")
                .description("Records evicted by maintenance")
                .tag("reason", "stale")
                .register(meterRegistry);
        positiveEvictions = Counter.builder("behaviorguard.store.evictions")
                .description("Records evicted by maintenance")
                .tag("reason", "detected")
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Actors.singleThread("store-maintenance");
        executor.scheduleWithFixedDelay(this::runSafely,
                config.getMaintenanceIntervalMs(), config.getMaintenanceIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Maintenance started: interval={} ms, staleness={}, grace={}",
                config.getMaintenanceIntervalMs(), config.getStalenessWindow(), config.getPositiveGrace());
    }

    public synchronized void stop() {
        Actors.shutdown(executor, "store-maintenance", SHUTDOWN_GRACE);
        executor = null;
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Maintenance pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One maintenance pass.
     *
     * @return number of evicted records
     */
    public int runOnce() {
        Instant now = store.now();
        int stale = store.evictStale(now, config.getStalenessWindow());
        int detected = store.evictExpiredPositives(now, config.getPositiveGrace());
        int decayed = store.decayScores(config.getScoreDecay());

        staleEvictions.increment(stale);
        positiveEvictions.increment(detected);
        if (stale + detected + decayed > 0) {
            log.debug("Maintenance: evicted {} stale and {} detected records, decayed {} scores, {} tracked",
                    stale, detected, decayed, store.size());
        }
        return stale + detected;
    }
}
