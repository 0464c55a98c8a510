package com.behaviorguard.detector.alert;

import com.behaviorguard.detector.detection.DecisionReason;
import com.behaviorguard.detector.detection.Verdict;

import java.time.Instant;

/**
 * Alert body posted to the webhook.
 *
 * @param label           classifier label, {@code unknown} without a classifier signal
 * @param confidence      classifier probability of {@code label}
 * @param fusedConfidence combined classifier and heuristic confidence that drove the verdict
 */
public record AlertPayload(
        String type,
        String severity,
        String label,
        double confidence,
        double fusedConfidence,
        int heuristicScore,
        int pid,
        Instant timestamp) {

    public static final String TYPE = "malware_detection";

    /**
     * Build a payload from a verdict. Severity is {@code critical} when the
     * heuristic ceiling decided, {@code high} otherwise.
     */
    public static AlertPayload from(Verdict verdict, Instant at) {
        String severity = verdict.reason() == DecisionReason.HEURISTIC_CEILING ? "critical" : "high";
        return new AlertPayload(TYPE, severity, verdict.labelOrUnknown(), verdict.classifierConfidence(),
                verdict.fusedConfidence(), verdict.heuristicScore(), verdict.pid(), at);
    }
}
