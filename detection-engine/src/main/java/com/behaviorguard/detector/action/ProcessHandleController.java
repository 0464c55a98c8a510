package com.behaviorguard.detector.action;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessController} over {@link ProcessHandle}.
 *
 * <p>
 * On Windows both {@code destroy} and {@code destroyForcibly} end in
 * TerminateProcess; on POSIX they map to SIGTERM and SIGKILL.
 * </p>
 */
@Component
public class ProcessHandleController implements ProcessController {

    @Override
    public boolean isAlive(int pid) {
        return handle(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean terminate(int pid) {
        Optional<ProcessHandle> handle = handle(pid);
        return handle.isPresent() && handle.get().destroy();
    }

    @Override
    public boolean forceKill(int pid) {
        Optional<ProcessHandle> handle = handle(pid);
        return handle.isPresent() && handle.get().destroyForcibly();
    }

    @Override
    public boolean awaitExit(int pid, Duration timeout) throws InterruptedException {
        Optional<ProcessHandle> handle = handle(pid);
        if (handle.isEmpty()) {
            return true;
        }
        try {
            handle.get().onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !handle.get().isAlive();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Exit watch failed for pid=" + pid, e.getCause());
        }
    }

    private static Optional<ProcessHandle> handle(int pid) {
        return ProcessHandle.of(pid);
    }
}
