package com.behaviorguard.detector.detection;

import java.util.List;

/**
 * Result of one analysis pass over a process.
 *
 * @param pid                  analyzed process, {@code -1} when not bound to one
 * @param classifierLabel      predicted class, null when the classifier gave no signal
 * @param classifierConfidence probability of {@code classifierLabel} in [0, 1]
 * @param heuristicScore       suspicion score in [0, 100] at analysis time
 * @param fusedConfidence      {@code (classifierConfidence + heuristicScore / 100) / 2}
 * @param malicious            final decision
 * @param contributingTokens   token buffer the decision was made on
 * @param reason               rule that decided
 */
public record Verdict(
        int pid,
        String classifierLabel,
        double classifierConfidence,
        int heuristicScore,
        double fusedConfidence,
        boolean malicious,
        List<String> contributingTokens,
        DecisionReason reason) {

    public Verdict {
        contributingTokens = contributingTokens == null ? List.of() : List.copyOf(contributingTokens);
    }

    /** Same decision bound to a process and the tokens it was made on. */
    public Verdict forProcess(int pid, List<String> tokens) {
        return new Verdict(pid, classifierLabel, classifierConfidence, heuristicScore,
                fusedConfidence, malicious, tokens, reason);
    }

    public String labelOrUnknown() {
        return classifierLabel != null ? classifierLabel : "unknown";
    }
}
