package com.behaviorguard.detector.engine;

import com.behaviorguard.detector.detection.HeuristicEngine;
import com.behaviorguard.detector.detection.Indicator;
import com.behaviorguard.detector.detection.IndicatorHit;
import com.behaviorguard.detector.event.BehaviorEvent;
import com.behaviorguard.detector.event.EventNormalizer;
import com.behaviorguard.detector.event.RawEvent;
import com.behaviorguard.detector.store.ProcessBehaviorStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Ingestion path for one raw record: normalize, record, evaluate heuristics,
 * apply their deltas and queue immediate analysis.
 */
@Component
public class EventProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    private final EventNormalizer normalizer;
    private final ProcessBehaviorStore store;
    private final HeuristicEngine heuristics;
    private final AnalysisRequestQueue requests;
    private final MeterRegistry meterRegistry;

    private Counter eventsRecorded;
    private Counter eventsFailed;
    private Counter aiCommunications;

    public EventProcessor(
            EventNormalizer normalizer,
            ProcessBehaviorStore store,
            HeuristicEngine heuristics,
            AnalysisRequestQueue requests,
            MeterRegistry meterRegistry) {
        this.normalizer = normalizer;
        this.store = store;
        this.heuristics = heuristics;
        this.requests = requests;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        eventsRecorded = Counter.builder("behaviorguard.events.recorded")
                .description("Events appended to a process record")
                .register(meterRegistry);
        eventsFailed = Counter.builder("behaviorguard.events.failed")
                .description("Events that raised while being processed")
                .register(meterRegistry);
        aiCommunications = Counter.builder("behaviorguard.ai_communications")
                .description("Connections or lookups to AI/C2 endpoints")
                .register(meterRegistry);
    }

    /**
     * Process one raw record. Never throws.
     *
     * @return true when the event was recorded against a process
     */
    public boolean process(RawEvent raw) {
        try {
            Optional<BehaviorEvent> normalized = normalizer.normalize(raw);
            if (normalized.isEmpty()) {
                return false;
            }
            BehaviorEvent event = normalized.get();
            if (!store.recordEvent(event)) {
                return false;
            }
            eventsRecorded.increment();

            List<IndicatorHit> hits = heuristics.evaluate(event);
            if (hits.isEmpty()) {
                return true;
            }

            store.applyIndicators(event.pid(), hits);
            boolean immediate = false;
            for (IndicatorHit hit : hits) {
                log.debug("Indicator {} (+{}) on pid={}: {}", hit.indicator().key(), hit.delta(),
                        event.pid(), hit.detail());
                if (hit.indicator() == Indicator.AI_COMMUNICATION) {
                    aiCommunications.increment();
                }
                immediate |= hit.immediate();
            }
            if (immediate) {
                requests.request(event.pid());
            }
            return true;

        } catch (Exception e) {
            eventsFailed.increment();
            log.error("Failed to process event id={}: {}", raw != null ? raw.eventId() : -1, e.getMessage(), e);
            return false;
        }
    }

    public long getAiCommunications() {
        return (long) aiCommunications.count();
    }
}
