package com.behaviorguard.detector.classifier;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierAdapterTest {

    private static final List<String> CLASSES = List.of("Benign", "Trojan", "Spyware");

    private SimpleMeterRegistry meterRegistry;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        calls = new AtomicInteger();
    }

    @Test
    void shouldReturnMostProbableClass() {
        ClassifierAdapter adapter = adapter(doc -> new double[] {0.1, 0.7, 0.2});

        Classification result = adapter.classify(List.of("VirtualAlloc", "CreateRemoteThread"));

        assertEquals("Trojan", result.label());
        assertEquals(0.7, result.confidence(), 1e-9);
        assertTrue(result.hasSignal());
        assertEquals(1, meterRegistry.timer("behaviorguard.classifier.latency").count());
    }

    @Test
    void shouldJoinTokensIntoDocument() {
        StringBuilder seen = new StringBuilder();
        ClassifierAdapter adapter = adapter(doc -> {
            seen.append(doc);
            return new double[] {1.0, 0.0, 0.0};
        });

        adapter.classify(List.of("CreateFile", "connect:10.0.0.5:443"));

        assertEquals("CreateFile connect:10.0.0.5:443", seen.toString());
    }

    @Test
    void shouldSkipPipelineForEmptySequence() {
        ClassifierAdapter adapter = adapter(doc -> new double[] {1.0, 0.0, 0.0});

        assertFalse(adapter.classify(List.of()).hasSignal());
        assertFalse(adapter.classify(null).hasSignal());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldDegradeToNoSignalOnPipelineError() {
        ClassifierAdapter adapter = adapter(doc -> {
            throw new IllegalStateException("model crashed");
        });

        Classification result = adapter.classify(List.of("CreateFile"));

        assertEquals(Classification.none(), result);
        assertEquals(1.0, meterRegistry.counter("behaviorguard.classifier.failures").count());
    }

    @Test
    void shouldRejectMalformedProbabilities() {
        assertFalse(adapter(doc -> new double[] {1.0}).classify(List.of("a")).hasSignal());
        assertFalse(adapter(doc -> new double[] {Double.NaN, Double.NaN, Double.NaN})
                .classify(List.of("a")).hasSignal());
        assertFalse(adapter(doc -> null).classify(List.of("a")).hasSignal());

        assertEquals(3.0, meterRegistry.counter("behaviorguard.classifier.failures").count());
    }

    private ClassifierAdapter adapter(Function<String, double[]> predict) {
        ModelPipeline pipeline = new ModelPipeline() {
            @Override
            public double[] predictProba(String document) {
                calls.incrementAndGet();
                return predict.apply(document);
            }

            @Override
            public List<String> classes() {
                return CLASSES;
            }
        };
        ClassifierAdapter adapter = new ClassifierAdapter(pipeline, meterRegistry);
        adapter.init();
        return adapter;
    }
}
