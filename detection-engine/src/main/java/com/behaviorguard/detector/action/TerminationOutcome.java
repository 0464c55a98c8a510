package com.behaviorguard.detector.action;

/**
 * Result of a quarantine request.
 */
public enum TerminationOutcome {

    /** Process exited after a graceful termination request. */
    TERMINATED,

    /** Graceful request timed out and the process was forcibly killed. */
    FORCE_KILLED,

    /** Process was already gone. Counts as success. */
    ALREADY_EXITED,

    /** Dry-run mode: logged, not executed. */
    DRY_RUN,

    /** Refused by a safety gate. */
    BLOCKED,

    /** Termination was attempted and failed. */
    FAILED,

    /** Quarantine is switched off. */
    DISABLED;

    public boolean isSuccess() {
        return this == TERMINATED || this == FORCE_KILLED || this == ALREADY_EXITED;
    }

    public String tag() {
        return name().toLowerCase();
    }
}
