package com.behaviorguard.detector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the response side of a positive verdict: quarantine,
 * evidence capture and the external alert channel.
 *
 * <p>
 * The alert webhook URL is normally supplied through the environment
 * ({@code BEHAVIORGUARD_RESPONSE_ALERT_WEBHOOK_URL}); when it is blank no alert
 * channel is created.
 * </p>
 */
@Configuration
@ConfigurationProperties(prefix = "behaviorguard.response")
@Validated
public class ResponseConfig {

    @Valid
    private Quarantine quarantine = new Quarantine();
    @Valid
    private Evidence evidence = new Evidence();
    @Valid
    private Alert alert = new Alert();

    public Quarantine getQuarantine() {
        return quarantine;
    }

    public void setQuarantine(Quarantine quarantine) {
        this.quarantine = quarantine;
    }

    public Evidence getEvidence() {
        return evidence;
    }

    public void setEvidence(Evidence evidence) {
        this.evidence = evidence;
    }

    public Alert getAlert() {
        return alert;
    }

    public void setAlert(Alert alert) {
        this.alert = alert;
    }

    public static class Quarantine {
        private boolean enabled = true;
        private boolean dryRun = false;
        @Min(100)
        private long terminationTimeoutMs = 5_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public long getTerminationTimeoutMs() {
            return terminationTimeoutMs;
        }

        public void setTerminationTimeoutMs(long terminationTimeoutMs) {
            this.terminationTimeoutMs = terminationTimeoutMs;
        }

        public Duration getTerminationTimeout() {
            return Duration.ofMillis(terminationTimeoutMs);
        }
    }

    public static class Evidence {
        private boolean enabled = true;
        @NotBlank
        private String path = "evidence";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Alert {
        private String webhookUrl = "";
        @Min(100)
        private long timeoutMs = 5_000;
        @Min(0)
        @Max(1)
        private int retries = 1;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public boolean isConfigured() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }
}
