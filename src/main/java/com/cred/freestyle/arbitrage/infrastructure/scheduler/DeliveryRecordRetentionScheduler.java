package com.cred.freestyle.arbitrage.infrastructure.scheduler;

import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.service.alert.AlertBookkeepingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Prunes delivery records older than the retention window. An opportunity whose record
 * was pruned is eligible for delivery again.
 *
 * @author Arbitrage Team
 */
@Service
public class DeliveryRecordRetentionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryRecordRetentionScheduler.class);

    private final AlertBookkeepingService bookkeepingService;
    private final ArbitrageMetricsService metricsService;
    private final Clock clock;
    private final Duration retention;

    public DeliveryRecordRetentionScheduler(
            AlertBookkeepingService bookkeepingService,
            ArbitrageMetricsService metricsService,
            Clock clock,
            @Value("${arbitrage.alerts.delivery.retention:P7D}") Duration retention
    ) {
        this.bookkeepingService = bookkeepingService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.retention = retention;
    }

    @Scheduled(cron = "${arbitrage.alerts.delivery.retention-cron:0 0 * * * *}")
    public void pruneExpiredRecords() {
        Instant cutoff = clock.instant().minus(retention);
        try {
            int pruned = bookkeepingService.pruneDeliveryRecords(cutoff);
            metricsService.recordDeliveryRecordsPruned(pruned);
            logger.info("Pruned {} delivery records sent before {}", pruned, cutoff);
        } catch (Exception e) {
            logger.error("Error pruning delivery records", e);
            metricsService.recordError("DELIVERY_RETENTION_ERROR", "pruneExpiredRecords");
        }
    }
}
