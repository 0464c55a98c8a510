package com.behaviorguard.detector.engine;

import com.behaviorguard.detector.action.MitigationCoordinator;
import com.behaviorguard.detector.classifier.Classification;
import com.behaviorguard.detector.classifier.Classifier;
import com.behaviorguard.detector.config.EngineConfig;
import com.behaviorguard.detector.detection.FusionEngine;
import com.behaviorguard.detector.detection.HeuristicEngine;
import com.behaviorguard.detector.detection.IndicatorHit;
import com.behaviorguard.detector.detection.Verdict;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import com.behaviorguard.detector.store.ProcessSnapshot;
import com.behaviorguard.detector.store.ProcessState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic analysis actor.
 *
 * <p>
 * Each pass first drains immediate-analysis requests (any record with at least
 * one token), then analyzes every record with at least {@code minEvidence}
 * tokens and new activity since its last analysis. Per process:
 * </p>
 * <ol>
 * <li>snapshot the record</li>
 * <li>match sequence indicators not yet raised on it and apply their deltas</li>
 * <li>classify the token buffer</li>
 * <li>fuse score and classification into a verdict</li>
 * <li>positive: mark for eviction and mitigate; clear: trim the buffer and keep
 * tracking</li>
 * </ol>
 *
 * <p>
 * Requests are also drained between passes on a short poll, so an immediate
 * indicator is analyzed within a fraction of a second instead of waiting for
 * the next full pass. Both run on the same thread.
 * </p>
 */
@Component
public class BehaviorSweeper {

    private static final Logger log = LoggerFactory.getLogger(BehaviorSweeper.class);

    static final long REQUEST_POLL_MS = 250;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final EngineConfig config;
    private final ProcessBehaviorStore store;
    private final HeuristicEngine heuristics;
    private final Classifier classifier;
    private final FusionEngine fusion;
    private final MitigationCoordinator mitigation;
    private final AnalysisRequestQueue requests;
    private final MeterRegistry meterRegistry;

    private ScheduledExecutorService executor;

    private Counter analyses;
    private Counter positives;
    private Counter analysisFailures;
    private Timer sweepDuration;

    public BehaviorSweeper(
            EngineConfig config,
            ProcessBehaviorStore store,
            HeuristicEngine heuristics,
            Classifier classifier,
            FusionEngine fusion,
            MitigationCoordinator mitigation,
            AnalysisRequestQueue requests,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.store = store;
        this.heuristics = heuristics;
        this.classifier = classifier;
        this.fusion = fusion;
        this.mitigation = mitigation;
        this.requests = requests;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        analyses = Counter.builder("behaviorguard.sweep.analyses")
                .description("Process analyses performed")
                .register(meterRegistry);
        positives = Counter.builder("behaviorguard.sweep.positives")
                .description("Analyses that produced a malicious verdict")
                .register(meterRegistry);
        analysisFailures = Counter.builder("behaviorguard.sweep.failures")
                .description("Process analyses that raised")
                .register(meterRegistry);
        sweepDuration = Timer.builder("behaviorguard.sweep.duration")
                .description("Duration of one full sweep pass")
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Actors.singleThread("behavior-sweeper");
        executor.scheduleWithFixedDelay(this::runSweep,
                config.getSweepIntervalMs(), config.getSweepIntervalMs(), TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(this::runRequests,
                REQUEST_POLL_MS, REQUEST_POLL_MS, TimeUnit.MILLISECONDS);
        log.info("Sweeper started: interval={} ms, minEvidence={}", config.getSweepIntervalMs(),
                config.getMinEvidence());
    }

    public synchronized void stop() {
        Actors.shutdown(executor, "behavior-sweeper", SHUTDOWN_GRACE);
        executor = null;
    }

    private void runSweep() {
        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("Sweep pass failed: {}", e.getMessage(), e);
        }
    }

    private void runRequests() {
        try {
            drainRequests(new HashSet<>());
        } catch (Exception e) {
            log.error("Immediate analysis failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One full pass: immediate requests first, then every eligible record.
     *
     * @return number of processes analyzed
     */
    public int sweepOnce() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Set<Integer> analyzed = new HashSet<>();
            int count = drainRequests(analyzed);
            for (int pid : store.eligibleForSweep(config.getMinEvidence())) {
                if (analyzed.add(pid) && analyzeSafely(pid).isPresent()) {
                    count++;
                }
            }
            if (count > 0) {
                log.debug("Sweep analyzed {} processes ({} tracked)", count, store.size());
            }
            return count;
        } finally {
            sample.stop(sweepDuration);
        }
    }

    private int drainRequests(Set<Integer> analyzed) {
        int count = 0;
        for (int pid : requests.drain()) {
            if (analyzed.add(pid) && analyzeSafely(pid).isPresent()) {
                count++;
            }
        }
        return count;
    }

    private Optional<Verdict> analyzeSafely(int pid) {
        try {
            return analyze(pid);
        } catch (Exception e) {
            analysisFailures.increment();
            log.error("Analysis of pid={} failed: {}", pid, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Analyze one process now.
     *
     * @return the verdict, or empty when the process is gone, already positive
     *         or has no tokens
     */
    Optional<Verdict> analyze(int pid) {
        Optional<ProcessSnapshot> current = store.snapshot(pid);
        if (current.isEmpty() || current.get().state() == ProcessState.ANALYZED_POSITIVE
                || current.get().tokenCount() == 0) {
            return Optional.empty();
        }
        ProcessSnapshot snapshot = current.get();

        List<IndicatorHit> sequenceHits = heuristics.evaluateSequence(snapshot.tokens()).stream()
                .filter(hit -> !store.hasIndicator(pid, hit.indicator().key()))
                .toList();
        int score = snapshot.suspicionScore();
        if (!sequenceHits.isEmpty()) {
            score = store.applyIndicators(pid, sequenceHits).orElse(score);
            sequenceHits.forEach(hit -> log.info("Sequence indicator {} (+{}) on pid={}: {}",
                    hit.indicator().key(), hit.delta(), pid, hit.detail()));
        }

        Classification classification = classifier.classify(snapshot.tokens());
        Verdict verdict = fusion.decide(pid, score, classification, snapshot.tokens());
        analyses.increment();

        if (verdict.malicious()) {
            positives.increment();
            store.markPositive(pid);
            ProcessSnapshot evidence = store.snapshot(pid).orElse(snapshot);
            mitigation.handle(verdict, evidence);
        } else {
            store.markClear(pid, config.getRetainedTokens());
            log.debug("pid={} clear: label={} confidence={} heuristic={} fused={} reason={}",
                    pid, verdict.labelOrUnknown(), verdict.classifierConfidence(), verdict.heuristicScore(),
                    verdict.fusedConfidence(), verdict.reason());
        }
        return Optional.of(verdict);
    }
}
