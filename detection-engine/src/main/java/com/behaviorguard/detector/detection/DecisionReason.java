package com.behaviorguard.detector.detection;

/**
 * The fusion rule that decided a verdict.
 */
public enum DecisionReason {

    /** Heuristic score above the hard ceiling. Beats a benign label. */
    HEURISTIC_CEILING,

    /** Fused confidence above the detection threshold. */
    FUSED_CONFIDENCE,

    /** Classifier confidence and heuristic score both above their soft floors. */
    SOFT_FLOORS,

    /** Would have been malicious, but the classifier said benign. */
    BENIGN_OVERRIDE,

    /** No rule fired. */
    NONE
}
