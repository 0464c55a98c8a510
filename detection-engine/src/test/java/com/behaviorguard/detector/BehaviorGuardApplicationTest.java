package com.behaviorguard.detector;

import com.behaviorguard.detector.action.MitigationCoordinator;
import com.behaviorguard.detector.alert.AlertService;
import com.behaviorguard.detector.classifier.Classifier;
import com.behaviorguard.detector.engine.BehaviorSweeper;
import com.behaviorguard.detector.engine.DetectionEngine;
import com.behaviorguard.detector.engine.EventProcessor;
import com.behaviorguard.detector.event.EventSource;
import com.behaviorguard.detector.event.QueueEventSource;
import com.behaviorguard.detector.event.RawEvent;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import com.behaviorguard.detector.store.ProcessState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "behaviorguard.engine.autostart=false",
                "behaviorguard.response.quarantine.dry-run=true",
                "behaviorguard.response.evidence.path=target/test-evidence",
                "behaviorguard.response.alert.webhook-url="
        })
class BehaviorGuardApplicationTest {

    private static final int PID = 999_991;

    @Autowired
    private DetectionEngine engine;

    @Autowired
    private EventSource eventSource;

    @Autowired
    private EventProcessor processor;

    @Autowired
    private BehaviorSweeper sweeper;

    @Autowired
    private ProcessBehaviorStore store;

    @Autowired
    private MitigationCoordinator mitigation;

    @Autowired
    private AlertService alertService;

    @Autowired
    private Classifier classifier;

    @Test
    void shouldStartIdleWithDefaults() {
        assertFalse(engine.isRunning());
        assertInstanceOf(QueueEventSource.class, eventSource);
        assertFalse(alertService.isConfigured());
        assertEquals("Trojan",
                classifier.classify(List.of("VirtualAlloc", "WriteProcessMemory", "CreateRemoteThread")).label());
    }

    @Test
    void shouldDetectInjectionIntoCredentialStore() {
        long before = mitigation.getDetections();

        assertTrue(processor.process(sysmon(8, 3, String.valueOf(PID), 4, "C:\\Users\\Public\\loader.exe",
                6, "640", 7, "C:\\Windows\\System32\\lsass.exe")));
        assertTrue(processor.process(sysmon(10, 3, String.valueOf(PID), 5, "C:\\Users\\Public\\loader.exe",
                7, "640", 8, "C:\\Windows\\System32\\lsass.exe", 9, "0x1010")));
        assertEquals(80, store.snapshot(PID).orElseThrow().suspicionScore());

        assertEquals(1, sweeper.sweepOnce());

        assertEquals(ProcessState.ANALYZED_POSITIVE, store.snapshot(PID).orElseThrow().state());
        assertEquals(before + 1, mitigation.getDetections());
        store.evict(PID);
    }

    private static RawEvent sysmon(int eventId, Object... indexValuePairs) {
        List<String> fields = new ArrayList<>(Arrays.asList(new String[21]));
        for (int i = 0; i < indexValuePairs.length; i += 2) {
            fields.set((Integer) indexValuePairs[i], (String) indexValuePairs[i + 1]);
        }
        return new RawEvent(eventId, null, "WS-01", fields);
    }
}
