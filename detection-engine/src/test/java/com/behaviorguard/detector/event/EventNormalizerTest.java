package com.behaviorguard.detector.event;

import com.behaviorguard.detector.config.IngestionConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventNormalizerTest {

    private IngestionConfig config;
    private SimpleMeterRegistry registry;
    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        config = new IngestionConfig();
        registry = new SimpleMeterRegistry();
        normalizer = new EventNormalizer(config, registry);
        normalizer.init();
    }

    @Test
    void shouldAttributeRemoteThreadToSourceProcess() {
        RawEvent raw = sysmon(8, 3, "4242", 4, "C:\\Users\\bob\\inject.exe", 6, "600", 7, "C:\\Windows\\explorer.exe");

        BehaviorEvent event = normalizer.normalize(raw).orElseThrow();

        assertEquals(4242, event.pid());
        assertEquals(EventKind.REMOTE_THREAD_CREATE, event.kind());
        assertEquals("C:\\Users\\bob\\inject.exe", event.image());
        assertEquals("600", event.attribute(BehaviorEvent.TARGET_PROCESS_ID));
        assertEquals("C:\\Windows\\explorer.exe", event.attribute(BehaviorEvent.TARGET_IMAGE));
    }

    @Test
    void shouldReadProcessAccessLayout() {
        RawEvent raw = sysmon(10, 3, "900", 5, "C:\\tools\\dump.exe", 7, "640",
                8, "C:\\Windows\\System32\\lsass.exe", 9, "0x1010");

        BehaviorEvent event = normalizer.normalize(raw).orElseThrow();

        assertEquals(900, event.pid());
        assertEquals(EventKind.PROCESS_ACCESS, event.kind());
        assertEquals("C:\\tools\\dump.exe", event.image());
        assertEquals("0x1010", event.attribute(BehaviorEvent.GRANTED_ACCESS));
    }

    @Test
    void shouldReadRegistryPidFromItsOwnPosition() {
        RawEvent raw = sysmon(13, 1, "SetValue", 4, "77", 5, "C:\\evil.exe",
                6, "HKU\\Software\\Microsoft\\Windows\\CurrentVersion\\Run\\Updater", 7, "C:\\evil.exe");

        BehaviorEvent event = normalizer.normalize(raw).orElseThrow();

        assertEquals(77, event.pid());
        assertEquals(EventKind.REGISTRY_WRITE, event.kind());
        assertEquals("SetValue", event.attribute(BehaviorEvent.REGISTRY_EVENT_TYPE));
        assertTrue(event.attribute(BehaviorEvent.TARGET_OBJECT).endsWith("\\Run\\Updater"));
    }

    @Test
    void shouldTolerateShortFieldArrays() {
        RawEvent raw = RawEvent.of(3, "", "", "", "321", "C:\\app.exe");

        BehaviorEvent event = normalizer.normalize(raw).orElseThrow();

        assertEquals(321, event.pid());
        assertFalse(event.has(BehaviorEvent.DESTINATION_IP));
        assertEquals("", event.attribute(BehaviorEvent.DESTINATION_PORT));
    }

    @Test
    void shouldTagOtherEventsWithOperation() {
        BehaviorEvent event = normalizer.normalize(sysmon(5, 3, "55", 4, "C:\\app.exe")).orElseThrow();

        assertEquals(EventKind.OTHER, event.kind());
        assertEquals("ProcessTerminate", event.attribute(BehaviorEvent.OPERATION));
    }

    @Test
    void shouldStripQualifierBitsFromEventId() {
        RawEvent raw = new RawEvent(0x4000_0001, null, "WS-01", fields(3, "12", 4, "C:\\a.exe"));

        BehaviorEvent event = normalizer.normalize(raw).orElseThrow();

        assertEquals(EventKind.PROCESS_CREATE, event.kind());
        assertEquals(1, event.eventId());
        assertNotNull(event.observedAt());
    }

    @Test
    void shouldDropUnmonitoredIds() {
        Optional<BehaviorEvent> event = normalizer.normalize(sysmon(4, 3, "12"));

        assertTrue(event.isEmpty());
        assertEquals(1.0, dropped("unmonitored"));
    }

    @Test
    void shouldHonorConfiguredMonitoredIds() {
        config.setMonitoredEventIds(Set.of(1));

        assertTrue(normalizer.normalize(sysmon(3, 3, "12", 4, "C:\\a.exe")).isEmpty());
        assertTrue(normalizer.normalize(sysmon(1, 3, "12", 4, "C:\\a.exe")).isPresent());
    }

    @Test
    void shouldDropRecordsWithoutPid() {
        assertTrue(normalizer.normalize(RawEvent.of(1, "a", "b")).isEmpty());
        assertTrue(normalizer.normalize(sysmon(1, 3, "not-a-pid")).isEmpty());
        assertTrue(normalizer.normalize(new RawEvent(1, null, null, null)).isEmpty());

        assertEquals(3.0, dropped("no_pid"));
    }

    @Test
    void shouldCountNullRecordAsMalformed() {
        assertTrue(normalizer.normalize(null).isEmpty());
        assertEquals(1.0, dropped("malformed"));
    }

    @Test
    void shouldCountNormalizedEvents() {
        normalizer.normalize(sysmon(1, 3, "12", 4, "C:\\a.exe"));
        normalizer.normalize(sysmon(11, 3, "12", 4, "C:\\a.exe", 5, "C:\\tmp\\x.exe"));

        assertEquals(2.0, registry.get("behaviorguard.normalizer.normalized").counter().count());
    }

    private double dropped(String reason) {
        return registry.get("behaviorguard.normalizer.dropped").tag("reason", reason).counter().count();
    }

    /** Raw Sysmon record from (index, value) pairs. */
    static RawEvent sysmon(int eventId, Object... indexValuePairs) {
        return new RawEvent(eventId, null, "WS-01", fields(indexValuePairs));
    }

    private static List<String> fields(Object... indexValuePairs) {
        List<String> fields = new ArrayList<>(Arrays.asList(new String[21]));
        for (int i = 0; i < indexValuePairs.length; i += 2) {
            fields.set((Integer) indexValuePairs[i], (String) indexValuePairs[i + 1]);
        }
        return fields;
    }
}
