package com.behaviorguard.detector.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Event source connection and batching configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "behaviorguard.ingestion")
@Validated
public class IngestionConfig {

    /** Spool file written by the external telemetry forwarder. Empty selects the in-memory queue. */
    private String spoolPath = "";

    @Min(1)
    private int batchSize = 256;

    @Min(1)
    private long pollTimeoutMs = 500;

    @Min(1)
    private long idleDelayMs = 100;

    @Min(1)
    private long retryDelayMs = 5_000;

    @Min(1)
    private int queueCapacity = 65_536;

    /** Sysmon event ids that are normalized. Everything else is dropped at the normalizer. */
    private Set<Integer> monitoredEventIds = new LinkedHashSet<>(
            List.of(1, 2, 3, 5, 7, 8, 10, 11, 12, 13, 14, 17, 18, 22, 23, 25));

    public String getSpoolPath() {
        return spoolPath;
    }

    public void setSpoolPath(String spoolPath) {
        this.spoolPath = spoolPath;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public long getIdleDelayMs() {
        return idleDelayMs;
    }

    public void setIdleDelayMs(long idleDelayMs) {
        this.idleDelayMs = idleDelayMs;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Set<Integer> getMonitoredEventIds() {
        return monitoredEventIds;
    }

    public void setMonitoredEventIds(Set<Integer> monitoredEventIds) {
        this.monitoredEventIds = monitoredEventIds;
    }

    public Duration getPollTimeout() {
        return Duration.ofMillis(pollTimeoutMs);
    }
}
