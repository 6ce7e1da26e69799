package com.cred.freestyle.arbitrage.infrastructure.webhook;

import com.cred.freestyle.arbitrage.exception.DeliveryException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs alert payloads to user webhooks.
 *
 * Retry policy: up to max-attempts tries with exponential backoff (initial-backoff-ms, doubling).
 * I/O errors, 5xx, 408 and 429 are retried; any other non-2xx status fails immediately.
 *
 * @author Arbitrage Team
 */
@Component
public class WebhookDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final RestTemplate restTemplate;
    private final ArbitrageMetricsService metricsService;
    private final int maxAttempts;
    private final long initialBackoffMs;

    public WebhookDispatcher(
            @Qualifier("webhookRestTemplate") RestTemplate restTemplate,
            ArbitrageMetricsService metricsService,
            @Value("${arbitrage.alerts.webhook.max-attempts:3}") int maxAttempts,
            @Value("${arbitrage.alerts.webhook.initial-backoff-ms:500}") long initialBackoffMs
    ) {
        this.restTemplate = restTemplate;
        this.metricsService = metricsService;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
    }

    /**
     * Deliver a payload. Returns normally only on a 2xx response.
     *
     * @throws DeliveryException if every attempt failed or the webhook rejected the payload
     */
    public void deliver(String webhookUrl, WebhookPayload payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<WebhookPayload> request = new HttpEntity<>(payload, headers);

        Integer lastStatus = null;
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long startTime = System.currentTimeMillis();
            try {
                restTemplate.postForEntity(webhookUrl, request, String.class);
                metricsService.recordWebhookAttempt("2xx", System.currentTimeMillis() - startTime);
                logger.info("Delivered {} opportunities for rule {} to {} (attempt {})",
                        payload.getOpportunities().size(), payload.getRuleId(), webhookUrl, attempt);
                return;
            } catch (RestClientResponseException e) {
                int status = e.getStatusCode().value();
                metricsService.recordWebhookAttempt(String.valueOf(status), System.currentTimeMillis() - startTime);
                lastStatus = status;
                lastError = e;
                if (!isRetryable(status)) {
                    logger.warn("Webhook {} rejected payload for rule {} with status {}",
                            webhookUrl, payload.getRuleId(), status);
                    throw new DeliveryException(webhookUrl, attempt, status, "HTTP " + status, e);
                }
                logger.warn("Webhook {} returned {} for rule {} (attempt {}/{})",
                        webhookUrl, status, payload.getRuleId(), attempt, maxAttempts);
            } catch (ResourceAccessException e) {
                metricsService.recordWebhookAttempt("IO_ERROR", System.currentTimeMillis() - startTime);
                lastStatus = null;
                lastError = e;
                logger.warn("Webhook {} unreachable for rule {} (attempt {}/{}): {}",
                        webhookUrl, payload.getRuleId(), attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                backoff(webhookUrl, attempt, lastStatus);
            }
        }

        String reason = lastStatus != null ? "HTTP " + lastStatus : "I/O error: " + lastError.getMessage();
        throw new DeliveryException(webhookUrl, maxAttempts, lastStatus, reason, lastError);
    }

    static boolean isRetryable(int status) {
        return status >= 500 || status == 408 || status == 429;
    }

    private void backoff(String webhookUrl, int attempt, Integer lastStatus) {
        long delay = initialBackoffMs * (1L << (attempt - 1));
        if (delay == 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(webhookUrl, attempt, lastStatus, "interrupted during backoff", e);
        }
    }
}
