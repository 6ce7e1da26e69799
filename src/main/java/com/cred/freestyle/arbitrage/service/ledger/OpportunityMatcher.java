package com.cred.freestyle.arbitrage.service.ledger;

import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
import com.cred.freestyle.arbitrage.domain.model.Money;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityAssessment;
import com.cred.freestyle.arbitrage.domain.model.OpportunityFilter;
import com.cred.freestyle.arbitrage.exception.CurrencyMismatchException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.repository.CanonicalSizeRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import com.cred.freestyle.arbitrage.service.assessment.OpportunityAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pairs buy-side offers with resale offers and ranks the resulting opportunities.
 *
 * Pairing rule: same product, same size key (same canonical size, or both sizeless),
 * both in stock, buy side RETAIL or WHOLESALE, sell side RESALE, resale price strictly
 * above buy price, same currency. AUCTION offers never pair.
 *
 * Price filters run on every pair; the assessment (demand, risk, feasibility) is computed
 * lazily, only for ranked pairs the caller actually consumes.
 *
 * @author Arbitrage Team
 */
@Component
public class OpportunityMatcher {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityMatcher.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Set<OfferKind> MATCHABLE_KINDS =
            EnumSet.of(OfferKind.RETAIL, OfferKind.WHOLESALE, OfferKind.RESALE);

    private final OfferRepository offerRepository;
    private final CanonicalSizeRepository canonicalSizeRepository;
    private final OpportunityAssessor assessor;
    private final ArbitrageMetricsService metricsService;

    public OpportunityMatcher(
            OfferRepository offerRepository,
            CanonicalSizeRepository canonicalSizeRepository,
            OpportunityAssessor assessor,
            ArbitrageMetricsService metricsService
    ) {
        this.offerRepository = offerRepository;
        this.canonicalSizeRepository = canonicalSizeRepository;
        this.assessor = assessor;
        this.metricsService = metricsService;
    }

    /**
     * Opportunities matching the filter, best first. The returned stream is finite and
     * backed by a snapshot read at call time; call again for fresh state.
     */
    @Transactional(readOnly = true)
    public Stream<Opportunity> listOpportunities(OpportunityFilter filter) {
        OpportunityFilter effective = filter != null ? filter : OpportunityFilter.none();
        long startTime = System.currentTimeMillis();

        List<Offer> offers = effective.getProductId() != null
                ? offerRepository.findMatchableForProduct(effective.getProductId(), MATCHABLE_KINDS)
                : offerRepository.findMatchable(MATCHABLE_KINDS);

        Map<String, String> sizeLabels = loadSizeLabels(offers);

        Map<String, List<Offer>> groups = new LinkedHashMap<>();
        for (Offer offer : offers) {
            groups.computeIfAbsent(offer.getProductId() + "|" + offer.getSizeKey(), k -> new ArrayList<>()).add(offer);
        }

        List<Opportunity> priced = new ArrayList<>();
        for (List<Offer> group : groups.values()) {
            List<Offer> buys = group.stream().filter(o -> o.getOfferKind().isBuySide()).collect(Collectors.toList());
            List<Offer> sells = group.stream().filter(o -> o.getOfferKind().isSellSide()).collect(Collectors.toList());
            for (Offer buy : buys) {
                for (Offer sell : sells) {
                    try {
                        pair(buy, sell, buy.isSized() ? sizeLabels.get(buy.getCanonicalSizeId()) : null)
                                .filter(o -> passesPriceFilters(o, effective))
                                .ifPresent(priced::add);
                    } catch (CurrencyMismatchException e) {
                        logger.warn("Skipping pair: {}", e.getMessage());
                        metricsService.recordCurrencyMismatch();
                    }
                }
            }
        }

        priced.sort(Opportunity.RANKING);
        metricsService.recordMatchingRun(priced.size(), System.currentTimeMillis() - startTime);
        logger.debug("Matched {} priced pairs from {} offers", priced.size(), offers.size());

        Stream<Opportunity> ranked = priced.stream();
        if (effective.requiresAssessment()) {
            ranked = ranked
                    .map(this::withAssessment)
                    .filter(o -> passesAssessmentFilters(o, effective));
        }
        if (effective.getLimit() != null) {
            ranked = ranked.limit(effective.getLimit());
        }
        return ranked;
    }

    /**
     * Attach the assessment if the opportunity does not carry one yet.
     */
    public Opportunity withAssessment(Opportunity opportunity) {
        if (opportunity.getAssessment() != null) {
            return opportunity;
        }
        return opportunity.withAssessment(assessor.assess(opportunity));
    }

    /**
     * Build the opportunity for a buy/sell pair.
     *
     * @return the opportunity, or empty if the pair does not match or is not profitable
     * @throws CurrencyMismatchException if the offers are priced in different currencies
     */
    public static Optional<Opportunity> pair(Offer buy, Offer sell, String sizeLabel) {
        if (!buy.getOfferKind().isBuySide() || !sell.getOfferKind().isSellSide()
                || !buy.isAvailable() || !sell.isAvailable()
                || !Objects.equals(buy.getProductId(), sell.getProductId())
                || !Objects.equals(buy.getSizeKey(), sell.getSizeKey())) {
            return Optional.empty();
        }
        if (!buy.getCurrency().equals(sell.getCurrency())) {
            throw new CurrencyMismatchException(buy.getOfferId(), buy.getCurrency(),
                    sell.getOfferId(), sell.getCurrency());
        }
        if (sell.getPrice() <= buy.getPrice()) {
            return Optional.empty();
        }

        String currency = buy.getCurrency();
        long profit = sell.getPrice() - buy.getPrice();
        BigDecimal profitAmount = Money.toMajor(profit, currency);
        BigDecimal marginPct = BigDecimal.valueOf(profit)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(buy.getPrice()), 2, RoundingMode.HALF_UP);
        BigDecimal score = profitAmount.multiply(marginPct)
                .divide(HUNDRED, 4, RoundingMode.HALF_UP);

        return Optional.of(Opportunity.builder()
                .productId(buy.getProductId())
                .canonicalSizeId(buy.getCanonicalSizeId())
                .sizeLabel(sizeLabel)
                .retailOffer(buy)
                .resaleOffer(sell)
                .currency(currency)
                .profit(profit)
                .profitAmount(profitAmount)
                .marginPct(marginPct)
                .opportunityScore(score)
                .build());
    }

    static boolean passesPriceFilters(Opportunity opportunity, OpportunityFilter filter) {
        if (filter.getMinMarginPct() != null && opportunity.getMarginPct().compareTo(filter.getMinMarginPct()) < 0) {
            return false;
        }
        if (filter.getMinProfit() != null && opportunity.getProfitAmount().compareTo(filter.getMinProfit()) < 0) {
            return false;
        }
        if (filter.getMaxBuyPrice() != null
                && opportunity.getRetailOffer().priceAmount().compareTo(filter.getMaxBuyPrice()) > 0) {
            return false;
        }
        String sourceFilter = filter.getSourceFilter();
        if (sourceFilter != null && !sourceFilter.isBlank()
                && !sourceFilter.trim().equalsIgnoreCase(opportunity.getRetailSource())
                && !sourceFilter.trim().equalsIgnoreCase(opportunity.getResaleSource())) {
            return false;
        }
        String brand = filter.extra(OpportunityFilter.BRAND);
        if (brand != null && !brand.equalsIgnoreCase(brandOf(opportunity))) {
            return false;
        }
        String retailSource = filter.extra(OpportunityFilter.RETAIL_SOURCE);
        if (retailSource != null && !retailSource.equalsIgnoreCase(opportunity.getRetailSource())) {
            return false;
        }
        String resaleSource = filter.extra(OpportunityFilter.RESALE_SOURCE);
        return resaleSource == null || resaleSource.equalsIgnoreCase(opportunity.getResaleSource());
    }

    static boolean passesAssessmentFilters(Opportunity opportunity, OpportunityFilter filter) {
        OpportunityAssessment assessment = opportunity.getAssessment();
        if (filter.getMinFeasibilityScore() != null
                && assessment.getFeasibilityScore() < filter.getMinFeasibilityScore()) {
            return false;
        }
        if (!assessment.getRiskLevel().isAtMost(filter.getMaxRiskLevel())) {
            return false;
        }
        String minDemand = filter.extra(OpportunityFilter.MIN_DEMAND_SCORE);
        return minDemand == null || new BigDecimal(minDemand).compareTo(BigDecimal.valueOf(assessment.getDemandScore())) <= 0;
    }

    private static String brandOf(Opportunity opportunity) {
        String brand = opportunity.getRetailOffer().getBrand();
        return brand != null ? brand : opportunity.getResaleOffer().getBrand();
    }

    private Map<String, String> loadSizeLabels(List<Offer> offers) {
        Set<String> ids = offers.stream()
                .map(Offer::getCanonicalSizeId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return canonicalSizeRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(CanonicalSize::getCanonicalSizeId, CanonicalSize::label, (a, b) -> a));
    }
}
