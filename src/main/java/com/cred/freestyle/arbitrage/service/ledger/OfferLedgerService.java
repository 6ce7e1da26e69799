package com.cred.freestyle.arbitrage.service.ledger;

import com.cred.freestyle.arbitrage.config.LedgerProperties;
import com.cred.freestyle.arbitrage.domain.model.Money;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferHistory;
import com.cred.freestyle.arbitrage.domain.model.OfferObservation;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityFilter;
import com.cred.freestyle.arbitrage.domain.model.ResolvedSize;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.cred.freestyle.arbitrage.domain.model.UpsertResult;
import com.cred.freestyle.arbitrage.domain.model.UpsertResult.Outcome;
import com.cred.freestyle.arbitrage.exception.ResourceNotFoundException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.repository.OfferHistoryRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import com.cred.freestyle.arbitrage.service.size.SizeStandardizationService;
import com.cred.freestyle.arbitrage.service.size.SizeValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Offer ledger: keeps the latest known state of every listing and its price history.
 *
 * Upsert protocol (one transaction):
 * 1. INSERT ... ON CONFLICT DO NOTHING on the natural key
 * 2. SELECT ... FOR UPDATE of the row by natural key
 * 3. Compare and update; append a history row when price, currency or stock changed
 *
 * Concurrent upserts of the same listing serialize on the row lock, so exactly one
 * row exists per natural key and every change is recorded once.
 *
 * @author Arbitrage Team
 */
@Service
public class OfferLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(OfferLedgerService.class);

    private final OfferRepository offerRepository;
    private final OfferHistoryRepository offerHistoryRepository;
    private final SizeStandardizationService sizeService;
    private final OpportunityMatcher opportunityMatcher;
    private final ArbitrageMetricsService metricsService;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    public OfferLedgerService(
            OfferRepository offerRepository,
            OfferHistoryRepository offerHistoryRepository,
            SizeStandardizationService sizeService,
            OpportunityMatcher opportunityMatcher,
            ArbitrageMetricsService metricsService,
            LedgerProperties ledgerProperties,
            Clock clock
    ) {
        this.offerRepository = offerRepository;
        this.offerHistoryRepository = offerHistoryRepository;
        this.sizeService = sizeService;
        this.opportunityMatcher = opportunityMatcher;
        this.metricsService = metricsService;
        this.ledgerProperties = ledgerProperties;
        this.clock = clock;
    }

    /**
     * Insert or update the offer for an observation. Idempotent per natural key.
     *
     * @param observation Observation from a feed
     * @return Stored offer and whether it was created, updated or unchanged
     * @throws IllegalArgumentException if the observation is incomplete
     * @throws com.cred.freestyle.arbitrage.exception.SizeNotFoundException if the size cannot be resolved
     */
    @Transactional
    public UpsertResult upsertOffer(OfferObservation observation) {
        long startTime = System.currentTimeMillis();
        validateObservation(observation);

        String currency = Money.normalizeCurrency(observation.getCurrency());
        boolean serverStamped = observation.getObservedAt() == null;
        Instant seenAt = (serverStamped ? clock.instant() : observation.getObservedAt())
                .truncatedTo(ChronoUnit.MICROS);

        ResolvedSize resolved = null;
        if (observation.isSized()) {
            if (observation.getGender() == null) {
                throw new IllegalArgumentException("Gender is required for sized offers");
            }
            resolved = sizeService.resolve(observation.getSizeStandard(), observation.getSizeValue(),
                    observation.getGender(), observation.getBrand(), observation.getCategory());
        }
        String canonicalSizeId = resolved != null ? resolved.getCanonicalSizeId() : null;
        String sizeKey = Offer.sizeKeyOf(canonicalSizeId);

        int inserted = offerRepository.insertIfAbsent(
                UUID.randomUUID().toString(),
                observation.getProductId(),
                observation.getSource(),
                observation.getSourceNativeId(),
                sizeKey,
                observation.getOfferKind().name(),
                observation.getPrice(),
                currency,
                observation.isInStock(),
                seenAt
        );

        Offer offer = offerRepository.findByNaturalKeyForUpdate(
                        observation.getProductId(), observation.getSource(),
                        observation.getSourceNativeId(), sizeKey)
                .orElseThrow(() -> new IllegalStateException(
                        "Offer vanished after insert: " + observation.getSource() + "/" + observation.getSourceNativeId()));

        if (serverStamped && inserted == 0) {
            // Unstamped observations are ordered by lock acquisition, so the last committer wins
            Instant lockedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
            seenAt = lockedAt.isAfter(offer.getLastSeenAt()) ? lockedAt : offer.getLastSeenAt();
        }

        Outcome outcome;
        if (inserted == 1) {
            offer.setCanonicalSizeId(canonicalSizeId);
            offer.setSizeAliasId(resolved != null ? resolved.getSizeAliasId() : null);
            if (observation.isSized()) {
                offer.setRawSizeStandard(observation.getSizeStandard());
                offer.setRawSizeValue(observation.getSizeValue().trim());
            }
            offer.setBrand(observation.getBrand());
            offer.setStockQty(observation.getStockQty());
            offerRepository.save(offer);
            offerHistoryRepository.save(OfferHistory.snapshotOf(offer, seenAt));
            outcome = Outcome.CREATED;
            logger.debug("Created offer {} for product {} from {}", offer.getOfferId(), offer.getProductId(), offer.getSource());
        } else if (seenAt.isBefore(offer.getLastSeenAt())) {
            // Late delivery of an older observation
            outcome = Outcome.UNCHANGED;
            logger.debug("Ignoring observation of offer {} older than last seen {}", offer.getOfferId(), offer.getLastSeenAt());
        } else if (offer.applyObservation(observation.getPrice(), currency, observation.isInStock(),
                observation.getStockQty(), seenAt)) {
            offerRepository.save(offer);
            offerHistoryRepository.save(OfferHistory.snapshotOf(offer, seenAt));
            outcome = Outcome.UPDATED;
            logger.debug("Updated offer {}: price={} {} inStock={}",
                    offer.getOfferId(), offer.getPrice(), offer.getCurrency(), offer.getInStock());
        } else {
            offerRepository.save(offer);
            outcome = Outcome.UNCHANGED;
        }

        if (resolved != null) {
            validateAdditionalSizes(canonicalSizeId, observation);
        }

        metricsService.recordOfferUpsert(observation.getSource(), outcome.name());
        metricsService.recordUpsertLatency(System.currentTimeMillis() - startTime);
        return new UpsertResult(offer, outcome);
    }

    private void validateObservation(OfferObservation observation) {
        if (observation == null) {
            throw new IllegalArgumentException("Observation is required");
        }
        if (isBlank(observation.getProductId()) || isBlank(observation.getSource())
                || isBlank(observation.getSourceNativeId())) {
            throw new IllegalArgumentException("productId, source and sourceNativeId are required");
        }
        if (observation.getOfferKind() == null) {
            throw new IllegalArgumentException("offerKind is required");
        }
        if (observation.getPrice() <= 0) {
            throw new IllegalArgumentException("price must be positive, got " + observation.getPrice());
        }
        if (observation.getStockQty() != null && observation.getStockQty() < 0) {
            throw new IllegalArgumentException("stockQty must not be negative");
        }
        requireMaxLength("productId", observation.getProductId(), Offer.MAX_PRODUCT_ID_LENGTH);
        requireMaxLength("source", observation.getSource(), Offer.MAX_SOURCE_LENGTH);
        requireMaxLength("sourceNativeId", observation.getSourceNativeId(), Offer.MAX_SOURCE_NATIVE_ID_LENGTH);
        requireMaxLength("brand", observation.getBrand(), Offer.MAX_BRAND_LENGTH);
        if (observation.getSizeValue() != null) {
            requireMaxLength("sizeValue", observation.getSizeValue().trim(), Offer.MAX_RAW_SIZE_VALUE_LENGTH);
        }
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException(field + " must be at most " + maxLength + " characters");
        }
    }

    /**
     * Cross-check other notations the source publishes. Disagreements are queued for
     * reconciliation and never block the upsert.
     */
    private void validateAdditionalSizes(String canonicalSizeId, OfferObservation observation) {
        for (Map.Entry<SizeStandard, String> entry : observation.getAdditionalSizes().entrySet()) {
            if (entry.getKey() == observation.getSizeStandard() || isBlank(entry.getValue())) {
                continue;
            }
            BigDecimal value;
            try {
                value = SizeValueParser.parse(entry.getValue()).getValue();
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping unparseable {} size '{}' from {}: {}",
                        entry.getKey(), entry.getValue(), observation.getSource(), e.getMessage());
                continue;
            }
            sizeService.validate(canonicalSizeId, entry.getKey(), value, observation.getSource());
        }
    }

    /**
     * Current opportunities, ordered by score. Each call re-reads offer state.
     */
    public Stream<Opportunity> listOpportunities(OpportunityFilter filter) {
        return opportunityMatcher.listOpportunities(filter);
    }

    @Transactional(readOnly = true)
    public Offer getOffer(String offerId) {
        return offerRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
    }

    /**
     * History of an offer, oldest first.
     */
    @Transactional(readOnly = true)
    public List<OfferHistory> getHistory(String offerId) {
        if (!offerRepository.existsById(offerId)) {
            throw new ResourceNotFoundException("Offer", offerId);
        }
        return offerHistoryRepository.findByOfferIdOrderByRecordedAtAsc(offerId);
    }

    /**
     * Mark in-stock offers not re-observed within their source's staleness window as out of stock.
     *
     * @param now Reference time
     * @return Number of offers expired
     */
    @Transactional
    public int sweepStaleOffers(Instant now) {
        int total = 0;
        for (String source : offerRepository.findSourcesWithStock()) {
            Instant cutoff = now.minus(ledgerProperties.stalenessFor(source));
            List<Offer> stale = offerRepository.findStaleForUpdate(source, cutoff);
            for (Offer offer : stale) {
                if (offer.expire(now)) {
                    offerRepository.save(offer);
                    offerHistoryRepository.save(OfferHistory.snapshotOf(offer, now));
                }
            }
            if (!stale.isEmpty()) {
                logger.info("Expired {} stale offers from source {} (last seen before {})", stale.size(), source, cutoff);
                metricsService.recordOffersExpired(source, stale.size());
            }
            total += stale.size();
        }
        return total;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
