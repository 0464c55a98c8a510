package com.behaviorguard.detector.detection;

/**
 * One raised indicator and the score delta it contributes.
 *
 * @param indicator the indicator
 * @param delta     suspicion score delta, applied additively and clamped by the store
 * @param detail    human-readable reason
 */
public record IndicatorHit(Indicator indicator, int delta, String detail) {

    public boolean immediate() {
        return indicator.isImmediate();
    }
}
