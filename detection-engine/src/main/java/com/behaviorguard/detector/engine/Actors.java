package com.behaviorguard.detector.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Executor plumbing shared by the engine actors.
 */
final class Actors {

    private static final Logger log = LoggerFactory.getLogger(Actors.class);

    private Actors() {
    }

    static ScheduledExecutorService singleThread(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Stop accepting new runs and wait for the current one to finish. Interrupts
     * the actor only when it overruns {@code grace}.
     */
    static void shutdown(ScheduledExecutorService executor, String name, Duration grace) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not finish within {} ms, interrupting", name, grace.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
