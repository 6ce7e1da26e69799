package com.cred.freestyle.arbitrage.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for ingestion, matching and alert delivery.
 * Published to CloudWatch through Micrometer (see CloudWatchConfig).
 *
 * Key Metrics:
 * - Offer upserts by outcome, rejected observations
 * - Opportunities found per listing, skipped currency mismatches
 * - Alert scans by outcome, webhook attempts and latency
 * - Size conflicts queued
 *
 * @author Arbitrage Team
 */
@Service
public class ArbitrageMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(ArbitrageMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "arbitrage.";
    private static final String OFFER_PREFIX = METRIC_PREFIX + "offer.";
    private static final String MATCH_PREFIX = METRIC_PREFIX + "match.";
    private static final String ALERT_PREFIX = METRIC_PREFIX + "alert.";
    private static final String SIZE_PREFIX = METRIC_PREFIX + "size.";

    public ArbitrageMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record an offer upsert.
     *
     * @param source Offer source
     * @param outcome CREATED, UPDATED or UNCHANGED
     */
    public void recordOfferUpsert(String source, String outcome) {
        Counter.builder(OFFER_PREFIX + "upsert")
                .tag("source", source)
                .tag("outcome", outcome)
                .description("Offer upserts by outcome")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an observation that could not be ingested.
     *
     * @param source Offer source
     * @param reason e.g. "SIZE_NOT_FOUND", "INVALID", "PARSE_ERROR"
     */
    public void recordOfferRejected(String source, String reason) {
        Counter.builder(OFFER_PREFIX + "rejected")
                .tag("source", source)
                .tag("reason", reason)
                .description("Rejected offer observations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded rejected observation for source: {}, reason: {}", source, reason);
    }

    public void recordOffersExpired(String source, int count) {
        Counter.builder(OFFER_PREFIX + "expired")
                .tag("source", source)
                .description("Offers marked out of stock by the staleness sweep")
                .register(meterRegistry)
                .increment(count);
    }

    public void recordUpsertLatency(long durationMs) {
        Timer.builder(OFFER_PREFIX + "upsert.latency")
                .description("Offer upsert latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record the ingestion of a Kafka batch.
     */
    public void recordIngestionBatch(int batchSize, int failed, long durationMs) {
        DistributionSummary.builder(OFFER_PREFIX + "batch.size")
                .description("Offer observations per consumed batch")
                .register(meterRegistry)
                .record(batchSize);
        Counter.builder(OFFER_PREFIX + "batch.failed")
                .description("Failed observations in consumed batches")
                .register(meterRegistry)
                .increment(failed);
        Timer.builder(OFFER_PREFIX + "batch.latency")
                .description("Batch ingestion time")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCurrencyMismatch() {
        Counter.builder(MATCH_PREFIX + "currency_mismatch")
                .description("Offer pairs skipped because of differing currencies")
                .register(meterRegistry)
                .increment();
    }

    public void recordMatchingRun(int pairsFound, long durationMs) {
        DistributionSummary.builder(MATCH_PREFIX + "pairs")
                .description("Priced pairs found per matching run")
                .register(meterRegistry)
                .record(pairsFound);
        Timer.builder(MATCH_PREFIX + "latency")
                .description("Opportunity matching latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record the outcome of one alert rule scan.
     *
     * @param outcome DELIVERED, EMPTY, FAILED, SKIPPED
     */
    public void recordAlertScan(String outcome) {
        Counter.builder(ALERT_PREFIX + "scan")
                .tag("outcome", outcome)
                .description("Alert rule scans by outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordOpportunitiesDelivered(int count) {
        Counter.builder(ALERT_PREFIX + "opportunities.delivered")
                .description("Opportunities delivered through webhooks")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record one webhook HTTP attempt.
     *
     * @param status HTTP status, or "IO_ERROR"
     * @param durationMs Attempt duration
     */
    public void recordWebhookAttempt(String status, long durationMs) {
        Counter.builder(ALERT_PREFIX + "webhook.attempt")
                .tag("status", status)
                .description("Webhook attempts by status")
                .register(meterRegistry)
                .increment();
        Timer.builder(ALERT_PREFIX + "webhook.latency")
                .description("Webhook attempt latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordDeliveryRecordsPruned(int count) {
        Counter.builder(ALERT_PREFIX + "delivery_records.pruned")
                .description("Delivery records removed by retention")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record a size mapping queued for reconciliation.
     *
     * @param outcome CONFLICT or UNVERIFIED
     */
    public void recordSizeValidation(String outcome) {
        Counter.builder(SIZE_PREFIX + "validation")
                .tag("outcome", outcome)
                .description("Size validations by outcome")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Error occurrences")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {}, operation: {}", errorType, operation);
    }
}
