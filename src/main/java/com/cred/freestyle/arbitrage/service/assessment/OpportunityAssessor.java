package com.cred.freestyle.arbitrage.service.assessment;

import com.cred.freestyle.arbitrage.config.AssessmentProperties;
import com.cred.freestyle.arbitrage.domain.model.OfferHistory;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityAssessment;
import com.cred.freestyle.arbitrage.domain.model.RiskLevel;
import com.cred.freestyle.arbitrage.repository.OfferHistoryRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes demand, risk and feasibility scores (0-100) for an opportunity.
 *
 * Demand: weekly trend of resale prices over the history window.
 * Risk: weighted sum of demand (0.30), volatility (0.25), stock (0.20),
 * margin (0.15) and buy platform (0.10) risk; below 30 is LOW, below 60 MEDIUM.
 * Feasibility: demand 0.4, inverse risk 0.3, margin 0.2, stock depth 0.1.
 *
 * @author Arbitrage Team
 */
@Component
public class OpportunityAssessor {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityAssessor.class);

    static final double WEIGHT_DEMAND = 0.30;
    static final double WEIGHT_VOLATILITY = 0.25;
    static final double WEIGHT_STOCK = 0.20;
    static final double WEIGHT_MARGIN = 0.15;
    static final double WEIGHT_PLATFORM = 0.10;

    private static final long WEEK_SECONDS = Duration.ofDays(7).getSeconds();

    private final OfferHistoryRepository offerHistoryRepository;
    private final OfferRepository offerRepository;
    private final AssessmentProperties properties;
    private final Clock clock;

    public OpportunityAssessor(
            OfferHistoryRepository offerHistoryRepository,
            OfferRepository offerRepository,
            AssessmentProperties properties,
            Clock clock
    ) {
        this.offerHistoryRepository = offerHistoryRepository;
        this.offerRepository = offerRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public OpportunityAssessment assess(Opportunity opportunity) {
        String sizeKey = opportunity.getResaleOffer().getSizeKey();
        Instant since = clock.instant().minus(Duration.ofDays(properties.getHistoryDays()));

        List<OfferHistory> history = offerHistoryRepository
                .findPriceHistory(opportunity.getProductId(), sizeKey, OfferKind.RESALE, since)
                .stream()
                .filter(h -> opportunity.getCurrency().equals(h.getCurrency()))
                .collect(Collectors.toList());

        Map<String, Object> demandBreakdown = new LinkedHashMap<>();
        int demand = demandScore(history, demandBreakdown);
        demandBreakdown.put("resale_sources",
                offerRepository.countSources(opportunity.getProductId(), sizeKey, OfferKind.RESALE));

        double margin = opportunity.getMarginPct().doubleValue();
        Integer stockQty = opportunity.getRetailOffer().getStockQty();

        double demandRisk = 100 - demand;
        double volatilityRisk = volatilityRisk(history.stream().map(h -> (double) h.getPrice()).collect(Collectors.toList()));
        double stockRisk = stockRisk(stockQty);
        double marginRisk = marginRisk(margin);
        double platformRisk = 100 - properties.reliabilityOf(opportunity.getRetailSource());

        int risk = clamp(WEIGHT_DEMAND * demandRisk
                + WEIGHT_VOLATILITY * volatilityRisk
                + WEIGHT_STOCK * stockRisk
                + WEIGHT_MARGIN * marginRisk
                + WEIGHT_PLATFORM * platformRisk);

        Map<String, Object> riskFactors = new LinkedHashMap<>();
        riskFactors.put("demand_risk", clamp(demandRisk));
        riskFactors.put("volatility_risk", clamp(volatilityRisk));
        riskFactors.put("stock_risk", clamp(stockRisk));
        riskFactors.put("margin_risk", clamp(marginRisk));
        riskFactors.put("platform_risk", clamp(platformRisk));

        int feasibility = feasibilityScore(demand, risk, margin, stockQty);

        logger.debug("Assessed {} {} -> {}: demand={}, risk={}, feasibility={}",
                opportunity.getRetailOffer().getOfferId(), opportunity.getResaleOffer().getOfferId(),
                opportunity.getProductId(), demand, risk, feasibility);

        return OpportunityAssessment.builder()
                .demandScore(demand)
                .riskScore(risk)
                .riskLevel(RiskLevel.fromScore(risk))
                .feasibilityScore(feasibility)
                .demandBreakdown(demandBreakdown)
                .riskFactors(riskFactors)
                .build();
    }

    /**
     * Demand from the slope of weekly average resale prices, as percent of the mean per week.
     */
    static int demandScore(List<OfferHistory> history, Map<String, Object> breakdown) {
        TreeMap<Long, List<Long>> weeks = new TreeMap<>();
        for (OfferHistory h : history) {
            weeks.computeIfAbsent(h.getRecordedAt().getEpochSecond() / WEEK_SECONDS, k -> new ArrayList<>())
                    .add(h.getPrice());
        }
        List<Double> weeklyAverages = weeks.values().stream()
                .map(prices -> prices.stream().mapToLong(Long::longValue).average().orElse(0))
                .collect(Collectors.toList());

        breakdown.put("data_points", weeklyAverages.size());
        if (weeklyAverages.size() < 2) {
            breakdown.put("trend_direction", "stable");
            breakdown.put("slope_pct", 0.0);
            return 50;
        }

        int n = weeklyAverages.size();
        double meanX = (n - 1) / 2.0;
        double meanY = weeklyAverages.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double numerator = 0;
        double denominator = 0;
        for (int x = 0; x < n; x++) {
            numerator += (x - meanX) * (weeklyAverages.get(x) - meanY);
            denominator += (x - meanX) * (x - meanX);
        }
        double slope = denominator == 0 ? 0 : numerator / denominator;
        double slopePct = meanY > 0 ? slope / meanY * 100 : 0;

        double score;
        String direction;
        if (slopePct > 2) {
            direction = "increasing";
            score = Math.min(100, 75 + slopePct * 5);
        } else if (slopePct < -2) {
            direction = "decreasing";
            score = Math.max(0, 50 + slopePct * 5);
        } else {
            direction = "stable";
            score = 60;
        }
        breakdown.put("trend_direction", direction);
        breakdown.put("slope_pct", Math.round(slopePct * 100) / 100.0);
        return clamp(score);
    }

    /**
     * Risk from the coefficient of variation of resale prices. Fewer than 3 points is neutral.
     */
    static double volatilityRisk(List<Double> prices) {
        if (prices.size() < 3) {
            return 50;
        }
        double mean = prices.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        if (mean <= 0) {
            return 50;
        }
        double variance = prices.stream().mapToDouble(p -> (p - mean) * (p - mean)).sum() / prices.size();
        double cv = Math.sqrt(variance) / mean * 100;

        if (cv < 5) {
            return 20 + cv / 5 * 30;
        } else if (cv < 10) {
            return 50 + (cv - 5) / 5 * 25;
        } else if (cv < 20) {
            return 75 + (cv - 10) / 10 * 20;
        }
        return 95;
    }

    /**
     * Risk of running out before the purchase goes through. Unknown stock is medium risk.
     */
    static double stockRisk(Integer stockQty) {
        if (stockQty == null) {
            return 50;
        }
        if (stockQty <= 0) {
            return 100;
        } else if (stockQty == 1) {
            return 80;
        } else if (stockQty <= 3) {
            return 60;
        } else if (stockQty <= 10) {
            return 40;
        } else if (stockQty <= 50) {
            return 20;
        }
        return 10;
    }

    static double marginRisk(double marginPct) {
        if (marginPct >= 50) {
            return 10;
        } else if (marginPct >= 30) {
            return 20 + (50 - marginPct) / 20 * 20;
        } else if (marginPct >= 20) {
            return 40 + (30 - marginPct) / 10 * 20;
        } else if (marginPct >= 10) {
            return 60 + (20 - marginPct) / 10 * 20;
        }
        return 80 + Math.max(0, 10 - marginPct) / 10 * 20;
    }

    static int feasibilityScore(int demand, int risk, double marginPct, Integer stockQty) {
        double marginScore = Math.min(100, marginPct / 50 * 100);
        double stockScore;
        if (stockQty == null) {
            stockScore = 50;
        } else if (stockQty <= 0) {
            stockScore = 0;
        } else if (stockQty <= 5) {
            stockScore = 50;
        } else if (stockQty <= 20) {
            stockScore = 75;
        } else {
            stockScore = 100;
        }
        return clamp(demand * 0.4 + (100 - risk) * 0.3 + marginScore * 0.2 + stockScore * 0.1);
    }

    private static int clamp(double score) {
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }
}
