package com.behaviorguard.detector.forensic;

import com.behaviorguard.detector.config.ResponseConfig;
import com.behaviorguard.detector.detection.Verdict;
import com.behaviorguard.detector.store.ProcessSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Preserves one evidence file per detection.
 *
 * <p>
 * Directory structure:
 * </p>
 *
 * <pre>
 * {evidence-path}/
 *   {yyyy-MM-dd}/
 *     detection_{pid}_{yyyyMMdd_HHmmss_SSS}.json
 * </pre>
 *
 * <p>
 * Files are created with {@code CREATE_NEW} and never rewritten. Failures are
 * logged and counted; they never reach the caller.
 * </p>
 */
@Component
public class EvidenceCollector {

    private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter STAMP_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneOffset.UTC);

    private static final int MAX_NAME_ATTEMPTS = 16;

    private final ResponseConfig responseConfig;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter evidenceCollected;
    private Counter evidenceFailed;

    @Autowired
    public EvidenceCollector(ResponseConfig responseConfig, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this(responseConfig, objectMapper, meterRegistry, Clock.systemUTC());
    }

    public EvidenceCollector(ResponseConfig responseConfig, ObjectMapper objectMapper, MeterRegistry meterRegistry,
            Clock clock) {
        this.responseConfig = responseConfig;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        evidenceCollected = Counter.builder("behaviorguard.evidence.collected")
                .description("Evidence records written")
                .register(meterRegistry);
        evidenceFailed = Counter.builder("behaviorguard.evidence.failed")
                .description("Evidence records that could not be written")
                .register(meterRegistry);

        ResponseConfig.Evidence evidence = responseConfig.getEvidence();
        if (!evidence.isEnabled()) {
            log.info("Evidence collection disabled");
            return;
        }
        Path basePath = Path.of(evidence.getPath());
        try {
            Files.createDirectories(basePath);
            log.info("Evidence directory: {}", basePath.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to create evidence directory {}: {}", basePath, e.getMessage());
        }
    }

    /**
     * Write the evidence record for a positive verdict.
     *
     * @return the written file, or empty when disabled or the write failed
     */
    public Optional<Path> collect(Verdict verdict, ProcessSnapshot snapshot) {
        ResponseConfig.Evidence evidence = responseConfig.getEvidence();
        if (!evidence.isEnabled()) {
            return Optional.empty();
        }
        try {
            Instant now = clock.instant();
            EvidenceRecord record = new EvidenceRecord(
                    EvidenceRecord.detectionId(verdict.pid(), now), now, verdict, snapshot);

            Path dir = Path.of(evidence.getPath(), DATE_FMT.format(now));
            Files.createDirectories(dir);
            Path file = writeOnce(dir, "detection_" + verdict.pid() + "_" + STAMP_FMT.format(now), record);

            evidenceCollected.increment();
            log.info("Evidence {} written to {}", record.detectionId(), file);
            return Optional.of(file);

        } catch (Exception e) {
            evidenceFailed.increment();
            log.error("Evidence collection failed for pid={}: {}", verdict.pid(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private Path writeOnce(Path dir, String baseName, EvidenceRecord record) throws IOException {
        for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
            Path file = dir.resolve(attempt == 0 ? baseName + ".json" : baseName + "_" + attempt + ".json");
            try (OutputStream out = Files.newOutputStream(file,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, record);
                return file;
            } catch (FileAlreadyExistsException e) {
                log.debug("Evidence file {} exists, trying next name", file);
            }
        }
        throw new IOException("No free evidence file name for " + baseName);
    }
}
