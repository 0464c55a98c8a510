package com.behaviorguard.detector.alert;

import com.behaviorguard.detector.config.ResponseConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Posts alerts as JSON to a configured HTTP endpoint.
 *
 * <p>
 * Delivery is fire-and-forget: each attempt is bounded by the alert timeout and
 * failed attempts are retried at most once. Outcomes are only logged.
 * </p>
 */
@Component
@ConditionalOnExpression("'${behaviorguard.response.alert.webhook-url:}'.trim().length() > 0")
public class WebhookAlertChannel implements AlertService.AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertChannel.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ResponseConfig.Alert config;

    @Autowired
    public WebhookAlertChannel(ResponseConfig responseConfig, ObjectMapper objectMapper) {
        this(WebClient.builder()
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build(), objectMapper, responseConfig);
    }

    WebhookAlertChannel(WebClient webClient, ObjectMapper objectMapper, ResponseConfig responseConfig) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = responseConfig.getAlert();
    }

    @Override
    public void send(AlertPayload payload) {
        deliver(payload).subscribe(
                ignored -> {
                },
                e -> log.warn("Webhook rejected alert for pid={}: {}", payload.pid(), e.getMessage()));
    }

    /**
     * The delivery pipeline, not yet subscribed.
     */
    Mono<Void> deliver(AlertPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Alert payload not serializable", e));
        }

        return webClient.post()
                .uri(config.getWebhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .retry(config.getRetries())
                .doOnSuccess(resp -> log.debug("Webhook accepted alert for pid={}", payload.pid()))
                .then();
    }

    @Override
    public String name() {
        return "webhook";
    }
}
