package com.behaviorguard.detector.detection;

/**
 * Hand-authored behavioral indicators.
 *
 * <p>
 * Event indicators are raised from a single event. Sequence indicators are
 * raised from the ordered token buffer and latch once per process record.
 * Indicators flagged {@code immediate} request analysis of the process
 * without waiting for the next sweep.
 * </p>
 */
public enum Indicator {

    INJECTION("injection", true, false),
    CRITICAL_PROCESS_ACCESS("critical_process_access", true, false),
    AI_COMMUNICATION("ai_communication", true, false),
    PERSISTENCE("persistence", false, false),
    SUSPICIOUS_FILE_DROP("suspicious_file_drop", false, false),
    PROCESS_TAMPERING("process_tampering", true, false),
    INJECTION_CHAIN("injection_chain", false, true),
    CREDENTIAL_ACCESS("credential_access", false, true),
    DROPPER_CHAIN("dropper_chain", false, true);

    private final String key;
    private final boolean immediate;
    private final boolean sequence;

    Indicator(String key, boolean immediate, boolean sequence) {
        this.key = key;
        this.immediate = immediate;
        this.sequence = sequence;
    }

    /** Stable name used in indicator counts, metrics tags and evidence. */
    public String key() {
        return key;
    }

    public boolean isImmediate() {
        return immediate;
    }

    public boolean isSequence() {
        return sequence;
    }
}
