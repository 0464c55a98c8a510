package com.behaviorguard.detector.config;

import com.behaviorguard.detector.event.EventSource;
import com.behaviorguard.detector.event.QueueEventSource;
import com.behaviorguard.detector.event.SpoolFileEventSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Selects the telemetry source.
 *
 * <p>
 * With a spool path configured the engine tails that file, otherwise it reads
 * from an in-memory queue that an embedding forwarder feeds.
 * </p>
 */
@Configuration
public class EventSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(EventSourceConfig.class);

    @Bean(destroyMethod = "close")
    public EventSource eventSource(IngestionConfig config, ObjectMapper objectMapper) {
        String spool = config.getSpoolPath();
        EventSource source = spool == null || spool.isBlank()
                ? new QueueEventSource(config.getQueueCapacity())
                : new SpoolFileEventSource(Path.of(spool), objectMapper);
        log.info("Event source: {}", source.describe());
        return source;
    }
}
