package com.cred.freestyle.arbitrage.exception;

/**
 * Exception thrown when a webhook could not be delivered within the retry budget,
 * or was rejected with a non-retryable status.
 *
 * @author Arbitrage Team
 */
public class DeliveryException extends RuntimeException {

    private final String webhookUrl;
    private final int attempts;
    private final Integer lastStatus;

    public DeliveryException(String webhookUrl, int attempts, Integer lastStatus, String reason, Throwable cause) {
        super(String.format("Webhook delivery to %s failed after %d attempt(s): %s",
                webhookUrl, attempts, reason), cause);
        this.webhookUrl = webhookUrl;
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Last HTTP status received, null if no response was received.
     */
    public Integer getLastStatus() {
        return lastStatus;
    }
}
