package com.behaviorguard.detector.action;

import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.config.ResponseConfig;
import com.behaviorguard.detector.detection.Verdict;
import com.behaviorguard.detector.store.ProcessSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Safety-gated process termination.
 *
 * <p>
 * Every request passes these gates in order:
 * </p>
 * <ol>
 * <li><b>Enabled:</b> quarantine can be switched off entirely.</li>
 * <li><b>Protected targets:</b> the engine's own process, pid 0 and 4,
 * critical system processes and whitelisted images are never terminated.</li>
 * <li><b>Rate limiting:</b> at most N terminations per minute.</li>
 * <li><b>Dry-run mode:</b> log what would happen without doing it.</li>
 * </ol>
 *
 * <p>
 * Termination is graceful first. If the process is still alive after the
 * termination timeout it is forcibly killed. A process that is already gone
 * counts as success.
 * </p>
 */
@Component
public class QuarantineExecutor {

    private static final Logger log = LoggerFactory.getLogger(QuarantineExecutor.class);

    /** Force-kill is synchronous on every supported OS; this only bounds the confirmation wait. */
    private static final Duration FORCE_KILL_CONFIRMATION = Duration.ofSeconds(1);

    private final ProcessController processController;
    private final ActionTracker actionTracker;
    private final ResponseConfig responseConfig;
    private final HeuristicsConfig heuristicsConfig;
    private final MeterRegistry meterRegistry;
    private final long ownPid = ProcessHandle.current().pid();

    private Counter actionsBlocked;
    private Counter actionsDryRun;

    public QuarantineExecutor(
            ProcessController processController,
            ActionTracker actionTracker,
            ResponseConfig responseConfig,
            HeuristicsConfig heuristicsConfig,
            MeterRegistry meterRegistry) {
        this.processController = processController;
        this.actionTracker = actionTracker;
        this.responseConfig = responseConfig;
        this.heuristicsConfig = heuristicsConfig;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        actionsBlocked = Counter.builder("behaviorguard.quarantine.blocked")
                .description("Terminations refused by safety gates")
                .register(meterRegistry);
        actionsDryRun = Counter.builder("behaviorguard.quarantine.dry_run")
                .description("Terminations that would have executed in non-dry-run mode")
                .register(meterRegistry);

        ResponseConfig.Quarantine quarantine = responseConfig.getQuarantine();
        log.info("QuarantineExecutor initialized: enabled={}, dryRun={}, timeout={}, rateLimit={}/min",
                quarantine.isEnabled(), quarantine.isDryRun(), quarantine.getTerminationTimeout(),
                actionTracker.getRateLimitPerMinute());
    }

    /**
     * Terminate the process behind a malicious verdict, subject to the safety gates.
     */
    public TerminationOutcome quarantine(Verdict verdict, ProcessSnapshot snapshot) {
        ResponseConfig.Quarantine quarantine = responseConfig.getQuarantine();
        int pid = verdict.pid();
        String image = snapshot != null ? snapshot.image() : "";

        if (!quarantine.isEnabled()) {
            log.debug("Quarantine disabled, leaving pid={} running", pid);
            return TerminationOutcome.DISABLED;
        }

        String protectedReason = protectedReason(pid, image);
        if (protectedReason != null) {
            actionsBlocked.increment();
            log.warn("SAFETY GATE: Termination blocked for pid={} image={}: {}", pid, image, protectedReason);
            actionTracker.record(pid, image, verdict.classifierLabel(), TerminationOutcome.BLOCKED);
            return TerminationOutcome.BLOCKED;
        }

        if (!actionTracker.tryAcquire()) {
            actionsBlocked.increment();
            log.warn("SAFETY GATE: Termination rate-limited for pid={} image={}", pid, image);
            actionTracker.record(pid, image, verdict.classifierLabel(), TerminationOutcome.BLOCKED);
            return TerminationOutcome.BLOCKED;
        }

        if (quarantine.isDryRun()) {
            actionsDryRun.increment();
            log.info("DRY-RUN: Would terminate pid={} image={} (label={}, fused={})",
                    pid, image, verdict.labelOrUnknown(), verdict.fusedConfidence());
            actionTracker.record(pid, image, verdict.classifierLabel(), TerminationOutcome.DRY_RUN);
            return TerminationOutcome.DRY_RUN;
        }

        TerminationOutcome outcome = terminate(pid, quarantine.getTerminationTimeout());
        actionTracker.record(pid, image, verdict.classifierLabel(), outcome);
        return outcome;
    }

    private String protectedReason(int pid, String image) {
        if (pid == ownPid) {
            return "engine's own process";
        }
        if (pid == 0 || pid == 4) {
            return "kernel process";
        }
        if (heuristicsConfig.isCriticalProcess(image)) {
            return "critical system process";
        }
        if (heuristicsConfig.isWhitelisted(image)) {
            return "whitelisted image";
        }
        return null;
    }

    private TerminationOutcome terminate(int pid, Duration timeout) {
        try {
            if (!processController.isAlive(pid)) {
                log.info("pid={} already exited before termination", pid);
                return TerminationOutcome.ALREADY_EXITED;
            }
            boolean requested = processController.terminate(pid);
            if (requested && processController.awaitExit(pid, timeout)) {
                log.info("Terminated pid={}", pid);
                return TerminationOutcome.TERMINATED;
            }
            if (!processController.isAlive(pid)) {
                return requested ? TerminationOutcome.TERMINATED : TerminationOutcome.ALREADY_EXITED;
            }

            log.warn("pid={} still running after graceful request ({} ms), forcing kill", pid, timeout.toMillis());
            if (!processController.forceKill(pid)) {
                return processController.isAlive(pid) ? TerminationOutcome.FAILED : TerminationOutcome.TERMINATED;
            }
            if (processController.awaitExit(pid, FORCE_KILL_CONFIRMATION)) {
                log.info("Force-killed pid={}", pid);
                return TerminationOutcome.FORCE_KILLED;
            }
            log.error("pid={} survived forced kill", pid);
            return TerminationOutcome.FAILED;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while terminating pid={}", pid);
            return TerminationOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Termination of pid={} failed: {}", pid, e.getMessage(), e);
            return TerminationOutcome.FAILED;
        }
    }
}
