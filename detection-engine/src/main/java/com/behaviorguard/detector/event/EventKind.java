package com.behaviorguard.detector.event;

import java.util.Arrays;

/**
 * Canonical behavioral event kinds and the Sysmon event ids that map to them.
 *
 * <p>
 * The set is closed: the normalizer, the tokenizer and the heuristic engine
 * switch over it exhaustively.
 * </p>
 */
public enum EventKind {

    PROCESS_CREATE("Process creation", 1),
    NETWORK_CONNECT("Network connection", 3),
    IMAGE_LOAD("Image/DLL load", 7),
    REMOTE_THREAD_CREATE("Remote thread creation", 8),
    PROCESS_ACCESS("Process access", 10),
    FILE_CREATE("File creation", 11),
    REGISTRY_WRITE("Registry modification", 12, 13, 14),
    DNS_QUERY("DNS query", 22),
    PROCESS_TAMPERING("Process image tampering", 25),
    OTHER("Other monitored activity", 2, 5, 17, 18, 23);

    private final String description;
    private final int[] wireValues;

    EventKind(String description, int... wireValues) {
        this.description = description;
        this.wireValues = wireValues;
    }

    public String getDescription() {
        return description;
    }

    public boolean covers(int eventId) {
        return Arrays.stream(wireValues).anyMatch(v -> v == eventId);
    }

    /**
     * Decode from a Sysmon event id.
     *
     * @param eventId event id with severity bits already stripped
     * @return the corresponding kind
     * @throws IllegalArgumentException if no kind covers the id
     */
    public static EventKind fromWireValue(int eventId) {
        for (EventKind kind : values()) {
            if (kind.covers(eventId)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event id: " + eventId);
    }
}
