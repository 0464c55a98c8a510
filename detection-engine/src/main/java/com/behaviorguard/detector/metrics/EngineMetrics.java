package com.behaviorguard.detector.metrics;

import com.behaviorguard.detector.action.MitigationCoordinator;
import com.behaviorguard.detector.engine.AnalysisRequestQueue;
import com.behaviorguard.detector.engine.EventProcessor;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Engine-wide gauges and a periodic status line.
 *
 * <p>
 * Registered gauges (per-component counters and timers live with their
 * components):
 * </p>
 * <ul>
 * <li>{@code behaviorguard.store.tracked} - records currently held</li>
 * <li>{@code behaviorguard.store.created} - records created since startup</li>
 * <li>{@code behaviorguard.analysis.pending} - queued immediate analyses</li>
 * <li>{@code behaviorguard.uptime_seconds} - engine uptime</li>
 * </ul>
 */
@Component
public class EngineMetrics {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);

    private final ProcessBehaviorStore store;
    private final AnalysisRequestQueue requests;
    private final EventProcessor processor;
    private final MitigationCoordinator mitigation;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public EngineMetrics(
            ProcessBehaviorStore store,
            AnalysisRequestQueue requests,
            EventProcessor processor,
            MitigationCoordinator mitigation,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.requests = requests;
        this.processor = processor;
        this.mitigation = mitigation;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("behaviorguard.store.tracked", store, ProcessBehaviorStore::size)
                .description("Process records currently tracked")
                .register(meterRegistry);

        Gauge.builder("behaviorguard.store.created", store, ProcessBehaviorStore::getProcessesTracked)
                .description("Process records created since startup")
                .register(meterRegistry);

        Gauge.builder("behaviorguard.analysis.pending", requests, AnalysisRequestQueue::size)
                .description("Processes waiting for immediate analysis")
                .register(meterRegistry);

        Gauge.builder("behaviorguard.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Detection engine uptime in seconds")
                .register(meterRegistry);

        log.info("Engine metrics registered");
    }

    /** Status line, every minute by default. */
    @Scheduled(fixedRateString = "${behaviorguard.metrics.status-interval-ms:60000}",
            initialDelayString = "${behaviorguard.metrics.status-interval-ms:60000}")
    public void logStatus() {
        try {
            log.info("Status: uptime={}s tracked={} created={} pending={} detections={} aiCommunications={}",
                    (System.currentTimeMillis() - startTime) / 1000, store.size(), store.getProcessesTracked(),
                    requests.size(), mitigation.getDetections(), processor.getAiCommunications());
        } catch (Exception e) {
            log.error("Status report failed: {}", e.getMessage(), e);
        }
    }
}
