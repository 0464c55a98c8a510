package com.behaviorguard.detector.classifier;

/**
 * Classifier output.
 *
 * @param label      predicted class, null when there is no signal
 * @param confidence probability of {@code label} in [0, 1]
 */
public record Classification(String label, double confidence) {

    private static final Classification NONE = new Classification(null, 0.0);

    /** No ML signal: failed or skipped classification. */
    public static Classification none() {
        return NONE;
    }

    public boolean hasSignal() {
        return label != null;
    }
}
