package com.behaviorguard.detector.store;

/**
 * Lifecycle of a tracked process. Unseen and evicted processes have no record.
 */
public enum ProcessState {
    /** Collecting behavior, not analyzed since the last reset. */
    TRACKED,
    /** Last analysis was clear; buffer trimmed and collection continues. */
    ANALYZED_CLEAR,
    /** Classified malicious and mitigated; retained until the grace period ends. */
    ANALYZED_POSITIVE
}
