package com.cred.freestyle.arbitrage.infrastructure.scheduler;

import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.service.ledger.OfferLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Marks offers that their source stopped confirming as out of stock, so they drop
 * out of matching. Offers are never deleted.
 *
 * @author Arbitrage Team
 */
@Service
public class OfferExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(OfferExpiryScheduler.class);

    private final OfferLedgerService ledgerService;
    private final ArbitrageMetricsService metricsService;
    private final Clock clock;

    @Value("${arbitrage.ledger.expiry-scheduler.enabled:true}")
    private boolean schedulerEnabled;

    public OfferExpiryScheduler(
            OfferLedgerService ledgerService,
            ArbitrageMetricsService metricsService,
            Clock clock
    ) {
        this.ledgerService = ledgerService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${arbitrage.ledger.expiry-scheduler.interval-ms:300000}")
    public void expireStaleOffers() {
        if (!schedulerEnabled) {
            logger.debug("Offer expiry scheduler is disabled");
            return;
        }
        long startTime = System.currentTimeMillis();
        try {
            int expired = ledgerService.sweepStaleOffers(clock.instant());
            if (expired > 0) {
                logger.info("Offer sweep completed: {} expired, duration: {}ms",
                        expired, System.currentTimeMillis() - startTime);
            } else {
                logger.debug("No stale offers found");
            }
        } catch (Exception e) {
            logger.error("Error in offer expiry scheduler", e);
            metricsService.recordError("OFFER_EXPIRY_SCHEDULER_ERROR", "expireStaleOffers");
        }
    }
}
