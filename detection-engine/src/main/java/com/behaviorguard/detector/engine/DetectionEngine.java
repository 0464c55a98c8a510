package com.behaviorguard.detector.engine;

import com.behaviorguard.detector.config.EngineConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle of the three engine actors.
 *
 * <p>
 * Started once the application is ready when autostart is on. On shutdown
 * ingestion stops first so no new work reaches the store, then the sweeper and
 * maintenance finish their current pass.
 * </p>
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final EngineConfig config;
    private final IngestionLoop ingestion;
    private final BehaviorSweeper sweeper;
    private final MaintenanceTask maintenance;

    private final AtomicBoolean running = new AtomicBoolean();

    public DetectionEngine(EngineConfig config, IngestionLoop ingestion, BehaviorSweeper sweeper,
            MaintenanceTask maintenance) {
        this.config = config;
        this.ingestion = ingestion;
        this.sweeper = sweeper;
        this.maintenance = maintenance;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.isAutostart()) {
            start();
        } else {
            log.info("Autostart disabled, detection engine idle");
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        maintenance.start();
        sweeper.start();
        ingestion.start();
        log.info("Detection engine started");
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping detection engine");
        ingestion.stop();
        sweeper.stop();
        maintenance.stop();
        log.info("Detection engine stopped");
    }

    public boolean isRunning() {
        return running.get();
    }
}
