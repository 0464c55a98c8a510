package com.behaviorguard.detector.event;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * A record as delivered by the external telemetry source: a numeric event id
 * and the positional string inserts of that event.
 *
 * <p>
 * Sources are allowed to deliver short or partially empty field arrays, so
 * every access goes through {@link #field(int)}.
 * </p>
 *
 * @param eventId     Sysmon event id (severity bits are stripped on access)
 * @param timeCreated time the source generated the record, may be null
 * @param computer    originating host name, may be null
 * @param fields      positional inserts, may be null
 */
public record RawEvent(
        int eventId,
        Instant timeCreated,
        String computer,
        List<String> fields) {

    /** The event id without the high severity/qualifier bits. */
    public int id() {
        return eventId & 0xFFFF;
    }

    /** Positional field, or null when absent or blank. */
    public String field(int index) {
        if (fields == null || index < 0 || index >= fields.size()) {
            return null;
        }
        String value = fields.get(index);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static RawEvent of(int eventId, String... fields) {
        return new RawEvent(eventId, Instant.now(), null, Arrays.asList(fields));
    }
}
