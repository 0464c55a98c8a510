package com.behaviorguard.detector.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sweep, maintenance and per-process buffer configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "behaviorguard.engine")
@Validated
public class EngineConfig {

    private boolean autostart = true;

    @Min(10)
    private long sweepIntervalMs = 10_000;

    @Min(100)
    private long maintenanceIntervalMs = 60_000;

    @Min(1)
    private int minEvidence = 5;

    @Min(1)
    private int bufferCapacity = 200;

    @Min(0)
    private int retainedTokens = 20;

    @Min(1)
    private long stalenessWindowMs = 300_000;

    @Min(0)
    private long positiveGraceMs = 30_000;

    @Min(0)
    private int scoreDecay = 5;

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getMaintenanceIntervalMs() {
        return maintenanceIntervalMs;
    }

    public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
        this.maintenanceIntervalMs = maintenanceIntervalMs;
    }

    public int getMinEvidence() {
        return minEvidence;
    }

    public void setMinEvidence(int minEvidence) {
        this.minEvidence = minEvidence;
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
        this.bufferCapacity = bufferCapacity;
    }

    public int getRetainedTokens() {
        return retainedTokens;
    }

    public void setRetainedTokens(int retainedTokens) {
        this.retainedTokens = retainedTokens;
    }

    public long getStalenessWindowMs() {
        return stalenessWindowMs;
    }

    public void setStalenessWindowMs(long stalenessWindowMs) {
        this.stalenessWindowMs = stalenessWindowMs;
    }

    public long getPositiveGraceMs() {
        return positiveGraceMs;
    }

    public void setPositiveGraceMs(long positiveGraceMs) {
        this.positiveGraceMs = positiveGraceMs;
    }

    public int getScoreDecay() {
        return scoreDecay;
    }

    public void setScoreDecay(int scoreDecay) {
        this.scoreDecay = scoreDecay;
    }

    public Duration getStalenessWindow() {
        return Duration.ofMillis(stalenessWindowMs);
    }

    public Duration getPositiveGrace() {
        return Duration.ofMillis(positiveGraceMs);
    }
}
