package com.behaviorguard.detector.classifier;

import java.util.List;

/**
 * A trained vectorize, select, reduce and predict pipeline.
 */
public interface ModelPipeline {

    /**
     * Class probabilities for a whitespace-joined token document, in the order
     * of {@link #classes()}.
     */
    double[] predictProba(String document);

    List<String> classes();
}
