package com.cred.freestyle.arbitrage.infrastructure.scheduler;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.repository.AlertRuleRepository;
import com.cred.freestyle.arbitrage.service.alert.AlertScanService;
import com.cred.freestyle.arbitrage.service.alert.AlertScanService.ScanOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Polls for due alert rules and scans them on a bounded worker pool.
 *
 * Each poll:
 * 1. Loads active rules and keeps those due at the poll time (interval elapsed,
 *    inside the rule's active hours and days, in the rule's timezone)
 * 2. Submits one scan per due rule to the alertScanExecutor
 * 3. Waits for every submitted scan before returning
 *
 * Fixed delay plus step 3 means polls never overlap. Several instances may poll
 * concurrently; the claim in AlertScanService ensures a rule is scanned once per cycle.
 *
 * @author Arbitrage Team
 */
@Service
public class AlertDispatchScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AlertDispatchScheduler.class);

    private final AlertRuleRepository alertRuleRepository;
    private final AlertScanService alertScanService;
    private final ThreadPoolTaskExecutor executor;
    private final ArbitrageMetricsService metricsService;
    private final Clock clock;

    @Value("${arbitrage.alerts.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    public AlertDispatchScheduler(
            AlertRuleRepository alertRuleRepository,
            AlertScanService alertScanService,
            @Qualifier("alertScanExecutor") ThreadPoolTaskExecutor executor,
            ArbitrageMetricsService metricsService,
            Clock clock
    ) {
        this.alertRuleRepository = alertRuleRepository;
        this.alertScanService = alertScanService;
        this.executor = executor;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${arbitrage.alerts.scheduler.poll-interval-ms:30000}")
    public void pollDueRules() {
        if (!schedulerEnabled) {
            logger.debug("Alert dispatch scheduler is disabled");
            return;
        }
        try {
            Map<ScanOutcome, Long> outcomes = runCycle(clock.instant());
            if (!outcomes.isEmpty()) {
                logger.info("Alert cycle completed: {}", outcomes);
            }
        } catch (Exception e) {
            logger.error("Error in alert dispatch scheduler", e);
            metricsService.recordError("ALERT_SCHEDULER_ERROR", "pollDueRules");
        }
    }

    /**
     * Run one poll cycle at the given time and wait for its scans.
     *
     * @return Number of scans per outcome
     */
    public Map<ScanOutcome, Long> runCycle(Instant now) {
        List<AlertRule> due = alertRuleRepository.findByActiveTrue().stream()
                .filter(rule -> rule.isDue(now))
                .collect(Collectors.toList());
        if (due.isEmpty()) {
            logger.debug("No alert rules due");
            return new EnumMap<>(ScanOutcome.class);
        }

        logger.info("Scanning {} due alert rules", due.size());
        List<CompletableFuture<ScanOutcome>> scans = new ArrayList<>();
        for (AlertRule rule : due) {
            try {
                scans.add(CompletableFuture.supplyAsync(() -> scanIsolated(rule, now), executor));
            } catch (TaskRejectedException e) {
                // Rule stays unclaimed and is picked up by the next poll
                logger.warn("Scan queue full, deferring rule {}", rule.getAlertRuleId());
            }
        }

        CompletableFuture.allOf(scans.toArray(new CompletableFuture[0])).join();
        return scans.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.groupingBy(o -> o, () -> new EnumMap<>(ScanOutcome.class), Collectors.counting()));
    }

    private ScanOutcome scanIsolated(AlertRule rule, Instant now) {
        try {
            return alertScanService.scan(rule, now);
        } catch (Exception e) {
            logger.error("Unexpected error scanning rule {}", rule.getAlertRuleId(), e);
            metricsService.recordError("ALERT_SCAN_ERROR", "scanIsolated");
            return ScanOutcome.FAILED;
        }
    }

    /**
     * Manual trigger (admin operation). Runs a cycle immediately.
     */
    public Map<ScanOutcome, Long> triggerScanNow() {
        logger.info("Manual alert scan triggered");
        return runCycle(clock.instant());
    }
}
