package com.behaviorguard.detector.event;

import java.time.Instant;
import java.util.Map;

/**
 * Canonical, immutable behavioral event attributed to a single process.
 *
 * <p>
 * For {@link EventKind#REMOTE_THREAD_CREATE} and {@link EventKind#PROCESS_ACCESS}
 * the event belongs to the source process; the target is carried in the
 * attributes.
 * </p>
 *
 * @param pid        process the behavior is attributed to
 * @param kind       canonical event kind
 * @param eventId    originating Sysmon event id
 * @param attributes Sysmon-named attributes, only non-blank values
 * @param observedAt time the event was generated
 */
public record BehaviorEvent(
        int pid,
        EventKind kind,
        int eventId,
        Map<String, String> attributes,
        Instant observedAt) {

    public static final String IMAGE = "Image";
    public static final String COMMAND_LINE = "CommandLine";
    public static final String PARENT_PROCESS_ID = "ParentProcessId";
    public static final String PARENT_IMAGE = "ParentImage";
    public static final String DESTINATION_IP = "DestinationIp";
    public static final String DESTINATION_HOSTNAME = "DestinationHostname";
    public static final String DESTINATION_PORT = "DestinationPort";
    public static final String IMAGE_LOADED = "ImageLoaded";
    public static final String TARGET_PROCESS_ID = "TargetProcessId";
    public static final String TARGET_IMAGE = "TargetImage";
    public static final String GRANTED_ACCESS = "GrantedAccess";
    public static final String TARGET_FILENAME = "TargetFilename";
    public static final String REGISTRY_EVENT_TYPE = "EventType";
    public static final String TARGET_OBJECT = "TargetObject";
    public static final String DETAILS = "Details";
    public static final String QUERY_NAME = "QueryName";
    public static final String QUERY_RESULTS = "QueryResults";
    public static final String TAMPER_TYPE = "Type";
    public static final String PIPE_NAME = "PipeName";
    public static final String OPERATION = "Operation";

    public BehaviorEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /** Attribute value, or an empty string when absent. */
    public String attribute(String name) {
        return attributes.getOrDefault(name, "");
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public String image() {
        return attribute(IMAGE);
    }
}
