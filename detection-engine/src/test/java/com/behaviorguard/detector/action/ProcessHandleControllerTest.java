package com.behaviorguard.detector.action;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProcessHandleControllerTest {

    /** Above the pid range of every supported OS. */
    private static final int MISSING_PID = Integer.MAX_VALUE;

    private final ProcessHandleController controller = new ProcessHandleController();

    @Test
    void shouldSeeOwnProcessAlive() {
        assertTrue(controller.isAlive((int) ProcessHandle.current().pid()));
    }

    @Test
    void shouldTreatMissingProcessAsGone() throws InterruptedException {
        assertFalse(controller.isAlive(MISSING_PID));
        assertFalse(controller.terminate(MISSING_PID));
        assertFalse(controller.forceKill(MISSING_PID));
        assertTrue(controller.awaitExit(MISSING_PID, Duration.ofMillis(10)));
    }
}
