package com.behaviorguard.detector.event;

/**
 * The telemetry source is temporarily unavailable. Callers back off and retry.
 */
public class EventSourceException extends Exception {

    public EventSourceException(String message) {
        super(message);
    }

    public EventSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
