package com.behaviorguard.detector.engine;

import com.behaviorguard.detector.action.MitigationCoordinator;
import com.behaviorguard.detector.action.TerminationOutcome;
import com.behaviorguard.detector.classifier.Classification;
import com.behaviorguard.detector.config.DetectionConfig;
import com.behaviorguard.detector.config.EngineConfig;
import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.detection.DecisionReason;
import com.behaviorguard.detector.detection.FusionEngine;
import com.behaviorguard.detector.detection.HeuristicEngine;
import com.behaviorguard.detector.detection.Verdict;
import com.behaviorguard.detector.store.BehaviorTokenizer;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import com.behaviorguard.detector.store.ProcessSnapshot;
import com.behaviorguard.detector.store.ProcessState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BehaviorSweeperTest {

    private static final String SAMPLE = "C:\\Users\\Public\\sample.exe";

    private SimpleMeterRegistry meterRegistry;
    private EngineConfig config;
    private ProcessBehaviorStore store;
    private AnalysisRequestQueue requests;
    private RecordingMitigation mitigation;
    private Classification nextClassification;
    private BehaviorSweeper sweeper;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        config = new EngineConfig();
        config.setMinEvidence(3);
        HeuristicsConfig heuristics = new HeuristicsConfig();
        store = new ProcessBehaviorStore(config, heuristics, new BehaviorTokenizer(heuristics), pid -> true);
        requests = new AnalysisRequestQueue();
        mitigation = new RecordingMitigation(meterRegistry);
        nextClassification = Classification.none();

        sweeper = new BehaviorSweeper(config, store, new HeuristicEngine(heuristics),
                tokens -> {
                    if (tokens.contains("Boom")) {
                        throw new IllegalStateException("classifier exploded");
                    }
                    return nextClassification;
                },
                new FusionEngine(new DetectionConfig()), mitigation, requests, meterRegistry);
        sweeper.init();
    }

    @Test
    void shouldDetectInjectionChainBackedByClassifier() {
        store.appendTokens(4242, SAMPLE, List.of("VirtualAlloc", "WriteProcessMemory", "CreateRemoteThread"));
        nextClassification = new Classification("Trojan", 0.6);

        assertEquals(1, sweeper.sweepOnce());

        assertEquals(1, mitigation.handled.size());
        Verdict verdict = mitigation.handled.get(0);
        assertEquals(4242, verdict.pid());
        assertEquals(50, verdict.heuristicScore());
        assertEquals(0.55, verdict.fusedConfidence(), 1e-9);
        assertEquals(DecisionReason.FUSED_CONFIDENCE, verdict.reason());

        ProcessSnapshot evidence = mitigation.snapshots.get(0);
        assertEquals(ProcessState.ANALYZED_POSITIVE, evidence.state());
        assertEquals(1, evidence.indicatorCount("injection_chain"));
        assertEquals(1.0, meterRegistry.counter("behaviorguard.sweep.positives").count());
    }

    @Test
    void shouldClearBenignProcessAndKeepTracking() {
        store.appendTokens(10, "C:\\Program Files\\app\\app.exe", List.of("CreateFile", "ReadFile", "CloseHandle"));
        nextClassification = new Classification("Benign", 0.95);

        assertEquals(1, sweeper.sweepOnce());

        assertTrue(mitigation.handled.isEmpty());
        ProcessSnapshot snapshot = store.snapshot(10).orElseThrow();
        assertEquals(ProcessState.ANALYZED_CLEAR, snapshot.state());
        assertEquals(1, snapshot.analysisCount());
    }

    @Test
    void shouldNotReanalyzeWithoutNewActivity() {
        store.appendTokens(10, SAMPLE, List.of("CreateFile", "ReadFile", "CloseHandle"));
        nextClassification = new Classification("Benign", 0.95);

        assertEquals(1, sweeper.sweepOnce());
        assertEquals(0, sweeper.sweepOnce());

        store.appendTokens(10, SAMPLE, List.of("RegQueryValue"));
        assertEquals(1, sweeper.sweepOnce());
    }

    @Test
    void shouldSkipProcessesBelowMinimumEvidence() {
        store.appendTokens(5, SAMPLE, List.of("CreateRemoteThread"));

        assertEquals(0, sweeper.sweepOnce());
    }

    @Test
    void shouldAnalyzeRequestedProcessBelowMinimumEvidence() {
        store.appendTokens(5, SAMPLE, List.of("CreateRemoteThread"));
        store.adjustScore(5, 80);
        requests.request(5);

        assertEquals(1, sweeper.sweepOnce());

        assertEquals(DecisionReason.HEURISTIC_CEILING, mitigation.handled.get(0).reason());
        assertEquals(0, requests.size());
    }

    @Test
    void shouldAnalyzeEachProcessOncePerPass() {
        store.appendTokens(5, SAMPLE, List.of("a", "b", "c"));
        requests.request(5);

        assertEquals(1, sweeper.sweepOnce());
        assertEquals(1.0, meterRegistry.counter("behaviorguard.sweep.analyses").count());
    }

    @Test
    void shouldIsolateFailingAnalysis() {
        store.appendTokens(1, SAMPLE, List.of("Boom", "b", "c"));
        store.appendTokens(2, SAMPLE, List.of("a", "b", "c"));

        assertEquals(1, sweeper.sweepOnce());

        assertEquals(1.0, meterRegistry.counter("behaviorguard.sweep.failures").count());
        assertEquals(ProcessState.ANALYZED_CLEAR, store.snapshot(2).orElseThrow().state());
    }

    @Test
    void shouldRaiseSequenceIndicatorOnlyOnce() {
        store.appendTokens(7, SAMPLE, List.of("VirtualAlloc", "WriteProcessMemory", "CreateRemoteThread"));
        nextClassification = new Classification("Benign", 0.95);

        Verdict first = sweeper.analyze(7).orElseThrow();
        assertEquals(50, first.heuristicScore());
        assertEquals(DecisionReason.BENIGN_OVERRIDE, first.reason());

        store.appendTokens(7, SAMPLE, List.of("CloseHandle"));
        Verdict second = sweeper.analyze(7).orElseThrow();

        assertEquals(50, second.heuristicScore());
        assertEquals(1, store.snapshot(7).orElseThrow().indicatorCount("injection_chain"));
    }

    @Test
    void shouldIgnoreUnknownAndDetectedProcesses() {
        assertTrue(sweeper.analyze(999).isEmpty());

        store.appendTokens(8, SAMPLE, List.of("a", "b", "c"));
        store.markPositive(8);
        assertTrue(sweeper.analyze(8).isEmpty());
    }

    private static class RecordingMitigation extends MitigationCoordinator {

        final List<Verdict> handled = new ArrayList<>();
        final List<ProcessSnapshot> snapshots = new ArrayList<>();

        RecordingMitigation(SimpleMeterRegistry meterRegistry) {
            super(null, null, null, meterRegistry);
        }

        @Override
        public Optional<TerminationOutcome> handle(Verdict verdict, ProcessSnapshot snapshot) {
            handled.add(verdict);
            snapshots.add(snapshot);
            return Optional.of(TerminationOutcome.DISABLED);
        }
    }
}
