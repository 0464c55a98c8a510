package com.behaviorguard.detector.classifier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the trained {@link ModelPipeline} behind the {@link Classifier} contract.
 *
 * <p>
 * Classification failure degrades to "no ML signal": an empty sequence or any
 * exception from the pipeline yields {@link Classification#none()}.
 * </p>
 */
@Component
public class ClassifierAdapter implements Classifier {

    private static final Logger log = LoggerFactory.getLogger(ClassifierAdapter.class);

    private final ModelPipeline pipeline;
    private final MeterRegistry meterRegistry;

    private Counter failures;
    private Timer latency;

    public ClassifierAdapter(ModelPipeline pipeline, MeterRegistry meterRegistry) {
        this.pipeline = pipeline;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        failures = Counter.builder("behaviorguard.classifier.failures")
                .description("Classification attempts that produced no signal due to an error")
                .register(meterRegistry);
        latency = Timer.builder("behaviorguard.classifier.latency")
                .description("Time spent in the model pipeline per classification")
                .register(meterRegistry);
        log.info("Classifier ready with classes {}", pipeline.classes());
    }

    @Override
    public Classification classify(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Classification.none();
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            double[] probabilities = pipeline.predictProba(String.join(" ", tokens));
            List<String> classes = pipeline.classes();
            if (probabilities == null || probabilities.length != classes.size()) {
                throw new IllegalStateException("Pipeline returned "
                        + (probabilities == null ? "no" : probabilities.length) + " probabilities for "
                        + classes.size() + " classes");
            }

            int best = 0;
            for (int i = 1; i < probabilities.length; i++) {
                if (probabilities[i] > probabilities[best]) {
                    best = i;
                }
            }
            double confidence = probabilities[best];
            if (Double.isNaN(confidence)) {
                throw new IllegalStateException("Pipeline returned NaN probability");
            }
            return new Classification(classes.get(best), Math.max(0.0, Math.min(1.0, confidence)));

        } catch (RuntimeException e) {
            failures.increment();
            log.error("Classification of {} tokens failed: {}", tokens.size(), e.getMessage(), e);
            return Classification.none();
        } finally {
            sample.stop(latency);
        }
    }
}
