package com.cred.freestyle.arbitrage.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * Criteria for listing opportunities. Every field is optional; money values are major units.
 *
 * @author Arbitrage Team
 */
@Value
@Builder
public class OpportunityFilter {

    public static final String BRAND = "brand";
    public static final String RETAIL_SOURCE = "retail_source";
    public static final String RESALE_SOURCE = "resale_source";
    public static final String MIN_DEMAND_SCORE = "min_demand_score";

    BigDecimal minMarginPct;

    BigDecimal minProfit;

    BigDecimal maxBuyPrice;

    /**
     * Matches either side's source, case-insensitive.
     */
    String sourceFilter;

    String productId;

    Integer minFeasibilityScore;

    RiskLevel maxRiskLevel;

    @Builder.Default
    Map<String, String> extraFilters = Collections.emptyMap();

    Integer limit;

    public static OpportunityFilter none() {
        return OpportunityFilter.builder().build();
    }

    /**
     * Filter derived from an alert rule's thresholds. No limit: the caller caps after deduplication.
     */
    public static OpportunityFilter forRule(AlertRule rule) {
        return OpportunityFilter.builder()
                .minMarginPct(rule.getMinMarginPct())
                .minProfit(rule.getMinProfit())
                .maxBuyPrice(rule.getMaxBuyPrice())
                .sourceFilter(rule.getSourceFilter())
                .minFeasibilityScore(rule.getMinFeasibilityScore())
                .maxRiskLevel(rule.getMaxRiskLevel())
                .extraFilters(rule.getExtraFilters() != null ? rule.getExtraFilters() : Collections.emptyMap())
                .build();
    }

    /**
     * Whether any criterion needs the assessment (demand/risk/feasibility) to be computed.
     */
    public boolean requiresAssessment() {
        return (minFeasibilityScore != null && minFeasibilityScore > 0)
                || (maxRiskLevel != null && maxRiskLevel != RiskLevel.HIGH)
                || extraFilters.containsKey(MIN_DEMAND_SCORE);
    }

    public String extra(String key) {
        String value = extraFilters.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
