package com.behaviorguard.detector.store;

/**
 * OS capability answering whether a process id still refers to a running
 * process.
 */
@FunctionalInterface
public interface ProcessLiveness {

    boolean isAlive(int pid);
}
