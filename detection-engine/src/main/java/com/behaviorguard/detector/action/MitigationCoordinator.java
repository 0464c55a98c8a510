package com.behaviorguard.detector.action;

import com.behaviorguard.detector.alert.AlertService;
import com.behaviorguard.detector.detection.Verdict;
import com.behaviorguard.detector.forensic.EvidenceCollector;
import com.behaviorguard.detector.store.ProcessSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Response pipeline for malicious verdicts: evidence, quarantine, alert,
 * counters.
 *
 * <p>
 * Each step is isolated. A failing step is logged and the next one still runs,
 * so a broken quarantine never hides a detection from the evidence trail or the
 * alert channel.
 * </p>
 */
@Service
public class MitigationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MitigationCoordinator.class);

    private final EvidenceCollector evidenceCollector;
    private final QuarantineExecutor quarantineExecutor;
    private final AlertService alertService;
    private final MeterRegistry meterRegistry;

    private Counter detections;
    private Counter mitigationFailures;

    public MitigationCoordinator(
            EvidenceCollector evidenceCollector,
            QuarantineExecutor quarantineExecutor,
            AlertService alertService,
            MeterRegistry meterRegistry) {
        this.evidenceCollector = evidenceCollector;
        this.quarantineExecutor = quarantineExecutor;
        this.alertService = alertService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        detections = Counter.builder("behaviorguard.detections")
                .description("Malicious verdicts handled")
                .register(meterRegistry);
        mitigationFailures = Counter.builder("behaviorguard.mitigation.failures")
                .description("Mitigation steps that raised")
                .register(meterRegistry);
    }

    /**
     * Handle a verdict. Clear verdicts are ignored.
     *
     * @return the quarantine outcome, or empty for a clear verdict
     */
    public Optional<TerminationOutcome> handle(Verdict verdict, ProcessSnapshot snapshot) {
        if (!verdict.malicious()) {
            return Optional.empty();
        }

        log.warn("MALWARE DETECTED: pid={} image={} label={} confidence={} heuristic={} fused={} reason={}",
                verdict.pid(), snapshot != null ? snapshot.image() : "", verdict.labelOrUnknown(),
                String.format("%.3f", verdict.classifierConfidence()), verdict.heuristicScore(),
                String.format("%.3f", verdict.fusedConfidence()), verdict.reason());

        // Step 1: evidence
        try {
            Optional<Path> evidence = evidenceCollector.collect(verdict, snapshot);
            if (evidence.isEmpty()) {
                log.debug("No evidence written for pid={}", verdict.pid());
            }
        } catch (Exception e) {
            mitigationFailures.increment();
            log.error("Evidence step failed for pid={}: {}", verdict.pid(), e.getMessage(), e);
        }

        // Step 2: quarantine
        TerminationOutcome outcome = TerminationOutcome.FAILED;
        try {
            outcome = quarantineExecutor.quarantine(verdict, snapshot);
        } catch (Exception e) {
            mitigationFailures.increment();
            log.error("Quarantine step failed for pid={}: {}", verdict.pid(), e.getMessage(), e);
        }

        // Step 3: alert
        try {
            alertService.sendAlert(verdict);
        } catch (Exception e) {
            mitigationFailures.increment();
            log.error("Alert step failed for pid={}: {}", verdict.pid(), e.getMessage(), e);
        }

        // Step 4: counters
        detections.increment();
        Counter.builder("behaviorguard.quarantines")
                .description("Quarantine requests by outcome")
                .tag("outcome", outcome.tag())
                .register(meterRegistry)
                .increment();
        if (snapshot != null) {
            for (Map.Entry<String, Integer> indicator : snapshot.indicatorCounts().entrySet()) {
                Counter.builder("behaviorguard.indicators")
                        .description("Indicators present on detected processes")
                        .tag("indicator", indicator.getKey())
                        .register(meterRegistry)
                        .increment(indicator.getValue());
            }
        }
        return Optional.of(outcome);
    }

    public long getDetections() {
        return (long) detections.count();
    }
}
