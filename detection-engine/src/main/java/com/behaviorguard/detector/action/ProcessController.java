package com.behaviorguard.detector.action;

import java.time.Duration;

/**
 * OS process-control capability, addressed by pid.
 */
public interface ProcessController {

    boolean isAlive(int pid);

    /**
     * Request graceful termination.
     *
     * @return false when the process does not exist
     */
    boolean terminate(int pid);

    /**
     * Kill without giving the process a chance to clean up.
     *
     * @return false when the process does not exist
     */
    boolean forceKill(int pid);

    /**
     * Wait for the process to exit.
     *
     * @return true when it exited (or was already gone) within the timeout
     */
    boolean awaitExit(int pid, Duration timeout) throws InterruptedException;
}
