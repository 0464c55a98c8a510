package com.behaviorguard.detector.metrics;

import com.behaviorguard.detector.action.MitigationCoordinator;
import com.behaviorguard.detector.config.EngineConfig;
import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.engine.AnalysisRequestQueue;
import com.behaviorguard.detector.store.BehaviorTokenizer;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private ProcessBehaviorStore store;
    private AnalysisRequestQueue requests;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        HeuristicsConfig heuristics = new HeuristicsConfig();
        store = new ProcessBehaviorStore(new EngineConfig(), heuristics, new BehaviorTokenizer(heuristics),
                pid -> true);
        requests = new AnalysisRequestQueue();
        MitigationCoordinator mitigation = new MitigationCoordinator(null, null, null, meterRegistry);
        mitigation.init();

        EngineMetrics metrics = new EngineMetrics(store, requests, null, mitigation, meterRegistry);
        metrics.registerGauges();
    }

    @Test
    void shouldTrackStoreAndQueueSizes() {
        store.appendTokens(1, "C:\\a.exe", List.of("CreateFile"));
        store.appendTokens(2, "C:\\b.exe", List.of("CreateFile"));
        store.evict(2);
        requests.request(1);

        assertEquals(1.0, meterRegistry.get("behaviorguard.store.tracked").gauge().value());
        assertEquals(2.0, meterRegistry.get("behaviorguard.store.created").gauge().value());
        assertEquals(1.0, meterRegistry.get("behaviorguard.analysis.pending").gauge().value());
        assertTrue(meterRegistry.get("behaviorguard.uptime_seconds").gauge().value() >= 0.0);
    }
}
