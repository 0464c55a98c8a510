package com.behaviorguard.detector.classifier;

import java.util.List;

/**
 * Classifies an ordered behavior token sequence.
 */
@FunctionalInterface
public interface Classifier {

    /**
     * @param tokens ordered tokens, oldest first
     * @return the most probable class and its probability, or
     *         {@link Classification#none()} when no prediction could be made
     */
    Classification classify(List<String> tokens);
}
