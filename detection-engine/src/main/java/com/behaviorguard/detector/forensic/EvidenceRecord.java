package com.behaviorguard.detector.forensic;

import com.behaviorguard.detector.detection.Verdict;
import com.behaviorguard.detector.store.ProcessSnapshot;

import java.time.Instant;

/**
 * Write-once record of one positive verdict and the process state it was made on.
 *
 * @param detectionId unique id, also used in alert logs
 * @param detectedAt  when the verdict was reached
 * @param verdict     the decision
 * @param process     process state at detection time
 */
public record EvidenceRecord(
        String detectionId,
        Instant detectedAt,
        Verdict verdict,
        ProcessSnapshot process) {

    public static String detectionId(int pid, Instant at) {
        return String.format("BG-%d-%d", at.toEpochMilli(), pid);
    }
}
