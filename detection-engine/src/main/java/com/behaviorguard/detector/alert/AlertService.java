package com.behaviorguard.detector.alert;

import com.behaviorguard.detector.detection.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Central alert dispatch.
 *
 * <p>
 * Routes detection alerts to every configured {@link AlertChannel} with
 * per-channel error isolation. With no channel configured alerts are only
 * logged.
 * </p>
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final List<AlertChannel> channels;
    private final MeterRegistry meterRegistry;

    private Counter alertsSent;
    private Counter alertsFailed;

    @Autowired
    public AlertService(ObjectProvider<AlertChannel> channels, MeterRegistry meterRegistry) {
        this(channels.orderedStream().toList(), meterRegistry);
    }

    public AlertService(List<AlertChannel> channels, MeterRegistry meterRegistry) {
        this.channels = List.copyOf(channels);
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        alertsSent = Counter.builder("behaviorguard.alert.sent")
                .description("Alerts handed to alert channels")
                .register(meterRegistry);
        alertsFailed = Counter.builder("behaviorguard.alert.failed")
                .description("Alert dispatch failures")
                .register(meterRegistry);

        log.info("Alert service initialized with {} channels: {}",
                channels.size(),
                channels.stream().map(AlertChannel::name).toList());
    }

    public boolean isConfigured() {
        return !channels.isEmpty();
    }

    /**
     * Dispatch an alert for a malicious verdict to all channels.
     *
     * @return number of channels that accepted the alert
     */
    public int sendAlert(Verdict verdict) {
        AlertPayload payload = AlertPayload.from(verdict, Instant.now());
        int accepted = 0;
        for (AlertChannel channel : channels) {
            try {
                channel.send(payload);
                alertsSent.increment();
                accepted++;
            } catch (Exception e) {
                alertsFailed.increment();
                log.error("Alert dispatch failed for {}: {}", channel.name(), e.getMessage());
            }
        }
        return accepted;
    }

    /** Pluggable alert destination. Implementations must not block. */
    public interface AlertChannel {

        void send(AlertPayload payload);

        default String name() {
            return getClass().getSimpleName();
        }
    }
}
