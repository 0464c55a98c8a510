package com.behaviorguard.detector.action;

import com.behaviorguard.detector.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ActionTrackerTest {

    private MutableClock clock;
    private ActionTracker tracker;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tracker = new ActionTracker(clock);
        Field field = ActionTracker.class.getDeclaredField("rateLimitPerMinute");
        field.setAccessible(true);
        field.setInt(tracker, 3);
    }

    @Test
    void shouldRefuseTerminationsBeyondBudget() {
        assertTrue(tracker.tryAcquire());
        assertTrue(tracker.tryAcquire());
        assertTrue(tracker.tryAcquire());

        assertFalse(tracker.tryAcquire());
        assertEquals(3, tracker.slotsInUse());
    }

    @Test
    void shouldFreeSlotsAsTheyAgeOut() {
        tracker.tryAcquire();
        clock.advance(Duration.ofSeconds(30));
        tracker.tryAcquire();
        tracker.tryAcquire();
        assertFalse(tracker.tryAcquire());

        clock.advance(Duration.ofSeconds(31));

        assertEquals(2, tracker.slotsInUse());
        assertTrue(tracker.tryAcquire());
        assertFalse(tracker.tryAcquire());
    }

    @Test
    void shouldCountAuditedOutcomes() {
        tracker.record(4242, "C:\\Users\\Public\\dropper.exe", "Dropper", TerminationOutcome.FORCE_KILLED);
        tracker.record(4243, "C:\\Windows\\System32\\lsass.exe", null, TerminationOutcome.BLOCKED);
        tracker.record(4244, "C:\\Temp\\spy.exe", "Spyware", TerminationOutcome.BLOCKED);

        assertEquals(3, tracker.getTotalActions());
        assertEquals(2, tracker.countOf(TerminationOutcome.BLOCKED));
        assertEquals(1, tracker.countOf(TerminationOutcome.FORCE_KILLED));
        assertEquals(0, tracker.countOf(TerminationOutcome.TERMINATED));
    }
}
