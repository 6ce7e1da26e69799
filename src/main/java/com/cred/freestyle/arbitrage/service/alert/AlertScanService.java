package com.cred.freestyle.arbitrage.service.alert;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityFilter;
import com.cred.freestyle.arbitrage.exception.DeliveryException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.infrastructure.webhook.WebhookDispatcher;
import com.cred.freestyle.arbitrage.infrastructure.webhook.WebhookPayload;
import com.cred.freestyle.arbitrage.repository.AlertRuleRepository;
import com.cred.freestyle.arbitrage.repository.DeliveryRecordRepository;
import com.cred.freestyle.arbitrage.service.ledger.OfferLedgerService;
import com.cred.freestyle.arbitrage.service.ledger.OpportunityMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one scan of one alert rule: claim, find new opportunities, deliver, record.
 *
 * The claim is a compare-and-set on last_scanned_at; a worker that loses the race
 * skips the rule. Nothing here runs inside a transaction spanning the webhook call:
 * the claim commits first, and the outcome is written afterwards by
 * AlertBookkeepingService in its own transaction.
 *
 * If the process stops between claim and bookkeeping, the cycle is skipped rather
 * than delivered twice.
 *
 * @author Arbitrage Team
 */
@Service
public class AlertScanService {

    private static final Logger logger = LoggerFactory.getLogger(AlertScanService.class);

    private final AlertRuleRepository alertRuleRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final OfferLedgerService ledgerService;
    private final OpportunityMatcher opportunityMatcher;
    private final OpportunityFingerprinter fingerprinter;
    private final WebhookDispatcher webhookDispatcher;
    private final AlertBookkeepingService bookkeepingService;
    private final ArbitrageMetricsService metricsService;
    private final Duration retention;

    public AlertScanService(
            AlertRuleRepository alertRuleRepository,
            DeliveryRecordRepository deliveryRecordRepository,
            OfferLedgerService ledgerService,
            OpportunityMatcher opportunityMatcher,
            OpportunityFingerprinter fingerprinter,
            WebhookDispatcher webhookDispatcher,
            AlertBookkeepingService bookkeepingService,
            ArbitrageMetricsService metricsService,
            @Value("${arbitrage.alerts.delivery.retention:P7D}") Duration retention
    ) {
        this.alertRuleRepository = alertRuleRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.ledgerService = ledgerService;
        this.opportunityMatcher = opportunityMatcher;
        this.fingerprinter = fingerprinter;
        this.webhookDispatcher = webhookDispatcher;
        this.bookkeepingService = bookkeepingService;
        this.metricsService = metricsService;
        this.retention = retention;
    }

    public enum ScanOutcome {
        /** Another worker claimed the rule, or it was deactivated. */
        SKIPPED,
        /** No new opportunity. */
        EMPTY,
        DELIVERED,
        FAILED
    }

    /**
     * Scan a rule that was found due at {@code now}.
     *
     * @param rule Rule as read by the poller (its last_scanned_at is the claim's expected value)
     * @param now Scan time
     * @return Outcome of the scan
     */
    public ScanOutcome scan(AlertRule rule, Instant now) {
        Instant scanTime = now.truncatedTo(ChronoUnit.MICROS);
        String ruleId = rule.getAlertRuleId();

        int claimed = rule.getLastScannedAt() == null
                ? alertRuleRepository.claimFirstScan(ruleId, scanTime)
                : alertRuleRepository.claim(ruleId, rule.getLastScannedAt(), scanTime);
        if (claimed == 0) {
            logger.debug("Rule {} already claimed by another worker", ruleId);
            metricsService.recordAlertScan(ScanOutcome.SKIPPED.name());
            return ScanOutcome.SKIPPED;
        }

        ScanOutcome outcome;
        try {
            outcome = scanClaimed(rule, scanTime);
        } catch (DeliveryException e) {
            logger.warn("Delivery for rule {} failed: {}", ruleId, e.getMessage());
            bookkeepingService.recordFailure(ruleId, e.getMessage(), scanTime);
            outcome = ScanOutcome.FAILED;
        } catch (RuntimeException e) {
            logger.error("Scan of rule {} failed", ruleId, e);
            bookkeepingService.recordFailure(ruleId, e.getClass().getSimpleName() + ": " + e.getMessage(), scanTime);
            metricsService.recordError("ALERT_SCAN_ERROR", "scan");
            outcome = ScanOutcome.FAILED;
        }
        metricsService.recordAlertScan(outcome.name());
        return outcome;
    }

    private ScanOutcome scanClaimed(AlertRule rule, Instant scanTime) {
        String ruleId = rule.getAlertRuleId();
        Set<String> delivered = new HashSet<>(
                deliveryRecordRepository.findFingerprintsSince(ruleId, scanTime.minus(retention)));

        Map<String, Opportunity> fresh = new LinkedHashMap<>();
        ledgerService.listOpportunities(OpportunityFilter.forRule(rule))
                .map(opportunity -> Map.entry(fingerprinter.fingerprint(opportunity), opportunity))
                .filter(entry -> !delivered.contains(entry.getKey()))
                .limit(rule.getMaxOpportunitiesPerAlert())
                .forEach(entry -> fresh.putIfAbsent(entry.getKey(), entry.getValue()));

        if (fresh.isEmpty()) {
            logger.debug("Rule {}: no new opportunities", ruleId);
            return ScanOutcome.EMPTY;
        }

        List<Opportunity> opportunities = new ArrayList<>(fresh.values());
        if (Boolean.TRUE.equals(rule.getIncludeDemandBreakdown()) || Boolean.TRUE.equals(rule.getIncludeRiskDetails())) {
            opportunities.replaceAll(opportunityMatcher::withAssessment);
        }

        webhookDispatcher.deliver(rule.getWebhookUrl(), WebhookPayload.of(rule, opportunities, scanTime));
        bookkeepingService.recordDelivery(ruleId, fresh.keySet(), scanTime);
        metricsService.recordOpportunitiesDelivered(opportunities.size());

        logger.info("Rule {}: delivered {} opportunities", ruleId, opportunities.size());
        return ScanOutcome.DELIVERED;
    }
}
