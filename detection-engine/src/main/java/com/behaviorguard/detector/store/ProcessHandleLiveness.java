package com.behaviorguard.detector.store;

import org.springframework.stereotype.Component;

/**
 * {@link ProcessLiveness} backed by {@link ProcessHandle}.
 */
@Component
public class ProcessHandleLiveness implements ProcessLiveness {

    @Override
    public boolean isAlive(int pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
