package com.behaviorguard.detector.event;

import com.behaviorguard.detector.config.IngestionConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.behaviorguard.detector.event.BehaviorEvent.*;

/**
 * Converts positional Sysmon records into {@link BehaviorEvent}s.
 *
 * <p>
 * Field positions follow the Sysmon event schema for each supported id.
 * Records for unmonitored ids, records without a parseable process id and
 * records that fail to parse are dropped and counted; nothing is thrown past
 * {@link #normalize(RawEvent)}.
 * </p>
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    /** Positional layout per event id: where the pid lives and which inserts to keep. */
    private static final Map<Integer, Layout> LAYOUTS = Map.ofEntries(
            Map.entry(1, new Layout(3, null,
                    Map.of(IMAGE, 4, COMMAND_LINE, 10, PARENT_PROCESS_ID, 19, PARENT_IMAGE, 20))),
            Map.entry(2, new Layout(3, "SetFileTime", Map.of(IMAGE, 4, TARGET_FILENAME, 5))),
            Map.entry(3, new Layout(3, null,
                    Map.of(IMAGE, 4, DESTINATION_IP, 14, DESTINATION_HOSTNAME, 15, DESTINATION_PORT, 16))),
            Map.entry(5, new Layout(3, "ProcessTerminate", Map.of(IMAGE, 4))),
            Map.entry(7, new Layout(3, null, Map.of(IMAGE, 4, IMAGE_LOADED, 5))),
            Map.entry(8, new Layout(3, null, Map.of(IMAGE, 4, TARGET_PROCESS_ID, 6, TARGET_IMAGE, 7))),
            Map.entry(10, new Layout(3, null,
                    Map.of(IMAGE, 5, TARGET_PROCESS_ID, 7, TARGET_IMAGE, 8, GRANTED_ACCESS, 9))),
            Map.entry(11, new Layout(3, null, Map.of(IMAGE, 4, TARGET_FILENAME, 5))),
            Map.entry(12, new Layout(4, null, Map.of(REGISTRY_EVENT_TYPE, 1, IMAGE, 5, TARGET_OBJECT, 6))),
            Map.entry(13, new Layout(4, null,
                    Map.of(REGISTRY_EVENT_TYPE, 1, IMAGE, 5, TARGET_OBJECT, 6, DETAILS, 7))),
            Map.entry(14, new Layout(4, null,
                    Map.of(REGISTRY_EVENT_TYPE, 1, IMAGE, 5, TARGET_OBJECT, 6, DETAILS, 7))),
            Map.entry(17, new Layout(4, "CreateNamedPipe", Map.of(PIPE_NAME, 5, IMAGE, 6))),
            Map.entry(18, new Layout(4, "ConnectNamedPipe", Map.of(PIPE_NAME, 5, IMAGE, 6))),
            Map.entry(22, new Layout(3, null, Map.of(QUERY_NAME, 4, QUERY_RESULTS, 6, IMAGE, 7))),
            Map.entry(23, new Layout(3, "DeleteFile", Map.of(IMAGE, 5, TARGET_FILENAME, 6))),
            Map.entry(25, new Layout(3, null, Map.of(IMAGE, 4, TAMPER_TYPE, 5))));

    private final IngestionConfig config;
    private final MeterRegistry meterRegistry;

    private Counter normalized;
    private Counter droppedUnmonitored;
    private Counter droppedNoPid;
    private Counter droppedMalformed;

    public EventNormalizer(IngestionConfig config, MeterRegistry meterRegistry) {
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        normalized = Counter.builder("behaviorguard.normalizer.normalized")
                .description("Raw records converted to behavior events")
                .register(meterRegistry);
        droppedUnmonitored = dropCounter("unmonitored");
        droppedNoPid = dropCounter("no_pid");
        droppedMalformed = dropCounter("malformed");
    }

    private Counter dropCounter(String reason) {
        return Counter.builder("behaviorguard.normalizer.dropped")
                .description("Raw records dropped by the normalizer")
                .tag("reason", reason)
                .register(meterRegistry);
    }

    /**
     * Normalize one raw record.
     *
     * @param raw the source record, may be null
     * @return the canonical event, or empty when the record is dropped
     */
    public Optional<BehaviorEvent> normalize(RawEvent raw) {
        if (raw == null) {
            droppedMalformed.increment();
            return Optional.empty();
        }
        try {
            int eventId = raw.id();
            Layout layout = LAYOUTS.get(eventId);
            if (layout == null || !config.getMonitoredEventIds().contains(eventId)) {
                droppedUnmonitored.increment();
                return Optional.empty();
            }

            Integer pid = parsePid(raw.field(layout.pidIndex()));
            if (pid == null) {
                droppedNoPid.increment();
                log.debug("Dropping event id={} without a usable process id", eventId);
                return Optional.empty();
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            layout.fields().forEach((name, index) -> {
                String value = raw.field(index);
                if (value != null) {
                    attributes.put(name, value);
                }
            });
            if (layout.operation() != null) {
                attributes.put(OPERATION, layout.operation());
            }

            Instant observedAt = raw.timeCreated() != null ? raw.timeCreated() : Instant.now();
            normalized.increment();
            return Optional.of(new BehaviorEvent(
                    pid, EventKind.fromWireValue(eventId), eventId, attributes, observedAt));

        } catch (RuntimeException e) {
            droppedMalformed.increment();
            log.debug("Dropping malformed event id={}: {}", raw.eventId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Integer parsePid(String value) {
        if (value == null) {
            return null;
        }
        try {
            int pid = Integer.parseInt(value.trim());
            return pid >= 0 ? pid : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record Layout(int pidIndex, String operation, Map<String, Integer> fields) {
    }
}
