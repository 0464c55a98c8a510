package com.behaviorguard.detector.detection;

import com.behaviorguard.detector.classifier.Classification;
import com.behaviorguard.detector.config.DetectionConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Combines the classifier confidence and the heuristic score into a verdict.
 *
 * <pre>
 * fused     = (confidence + heuristicScore / 100) / 2
 * malicious = fused &gt; detectionThreshold
 *          || heuristicScore &gt; hardHeuristicCeiling
 *          || (confidence &gt; mlSoftFloor &amp;&amp; heuristicScore &gt; heuristicSoftFloor)
 * </pre>
 *
 * A {@code Benign} label (any case) forces a clear verdict unless the hard
 * heuristic ceiling is exceeded. Decisions are pure functions of the inputs and
 * the configured thresholds.
 */
@Component
public class FusionEngine {

    static final String BENIGN_LABEL = "Benign";

    private final DetectionConfig config;

    public FusionEngine(DetectionConfig config) {
        this.config = config;
    }

    /**
     * Decide on raw inputs. The returned verdict is not bound to a process.
     *
     * @param heuristicScore       clamped to [0, 100]
     * @param classifierConfidence clamped to [0, 1], NaN is treated as 0
     * @param classifierLabel      may be null when the classifier gave no signal
     */
    public Verdict decide(int heuristicScore, double classifierConfidence, String classifierLabel) {
        int score = Math.max(0, Math.min(100, heuristicScore));
        double confidence = Double.isNaN(classifierConfidence)
                ? 0.0
                : Math.max(0.0, Math.min(1.0, classifierConfidence));

        double fused = (confidence + score / 100.0) / 2.0;

        DecisionReason reason;
        if (score > config.getHardHeuristicCeiling()) {
            reason = DecisionReason.HEURISTIC_CEILING;
        } else if (fused > config.getDetectionThreshold()) {
            reason = DecisionReason.FUSED_CONFIDENCE;
        } else if (confidence > config.getMlSoftFloor() && score > config.getHeuristicSoftFloor()) {
            reason = DecisionReason.SOFT_FLOORS;
        } else {
            reason = DecisionReason.NONE;
        }

        if (reason != DecisionReason.NONE && reason != DecisionReason.HEURISTIC_CEILING
                && BENIGN_LABEL.equalsIgnoreCase(classifierLabel)) {
            reason = DecisionReason.BENIGN_OVERRIDE;
        }

        boolean malicious = reason != DecisionReason.NONE && reason != DecisionReason.BENIGN_OVERRIDE;
        return new Verdict(-1, classifierLabel, confidence, score, fused, malicious, List.of(), reason);
    }

    /** Decide for one analyzed process. */
    public Verdict decide(int pid, int heuristicScore, Classification classification, List<String> tokens) {
        return decide(heuristicScore, classification.confidence(), classification.label())
                .forProcess(pid, tokens);
    }
}
