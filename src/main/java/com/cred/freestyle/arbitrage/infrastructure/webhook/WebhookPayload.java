package com.cred.freestyle.arbitrage.infrastructure.webhook;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityAssessment;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON body POSTed to an alert rule's webhook.
 *
 * @author Arbitrage Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookPayload {

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("rule_name")
    private String ruleName;

    /**
     * ISO-8601 UTC.
     */
    @JsonProperty("generated_at")
    private String generatedAt;

    /**
     * Set when every opportunity shares one currency.
     */
    @JsonProperty("currency")
    private String currency;

    @JsonProperty("opportunities")
    private List<Item> opportunities;

    @JsonProperty("demand_breakdown")
    private List<Map<String, Object>> demandBreakdown;

    @JsonProperty("risk_details")
    private List<Map<String, Object>> riskDetails;

    public static WebhookPayload of(AlertRule rule, List<Opportunity> opportunities, Instant generatedAt) {
        List<String> currencies = opportunities.stream()
                .map(Opportunity::getCurrency)
                .distinct()
                .collect(Collectors.toList());

        WebhookPayloadBuilder builder = WebhookPayload.builder()
                .ruleId(rule.getAlertRuleId())
                .ruleName(rule.getName())
                .generatedAt(generatedAt.toString())
                .currency(currencies.size() == 1 ? currencies.get(0) : null)
                .opportunities(opportunities.stream().map(Item::of).collect(Collectors.toList()));

        if (Boolean.TRUE.equals(rule.getIncludeDemandBreakdown())) {
            builder.demandBreakdown(opportunities.stream()
                    .filter(o -> o.getAssessment() != null)
                    .map(o -> detail(o, "demand_score", o.getAssessment().getDemandScore(),
                            o.getAssessment().getDemandBreakdown()))
                    .collect(Collectors.toList()));
        }
        if (Boolean.TRUE.equals(rule.getIncludeRiskDetails())) {
            builder.riskDetails(opportunities.stream()
                    .filter(o -> o.getAssessment() != null)
                    .map(o -> {
                        OpportunityAssessment a = o.getAssessment();
                        Map<String, Object> detail = detail(o, "risk_score", a.getRiskScore(), a.getRiskFactors());
                        detail.put("risk_level", a.getRiskLevel().name());
                        detail.put("feasibility_score", a.getFeasibilityScore());
                        return detail;
                    })
                    .collect(Collectors.toList()));
        }
        return builder.build();
    }

    private static Map<String, Object> detail(Opportunity o, String scoreKey, int score, Map<String, Object> factors) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("product_id", o.getProductId());
        detail.put("size", o.getSizeLabel());
        detail.put("retail_offer_id", o.getRetailOffer().getOfferId());
        detail.put("resale_offer_id", o.getResaleOffer().getOfferId());
        detail.put(scoreKey, score);
        if (factors != null) {
            detail.putAll(factors);
        }
        return detail;
    }

    /**
     * One opportunity. Prices and profit are major currency units.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {

        @JsonProperty("product_id")
        private String productId;

        @JsonProperty("size")
        private String size;

        @JsonProperty("retail_source")
        private String retailSource;

        @JsonProperty("retail_price")
        private BigDecimal retailPrice;

        @JsonProperty("resale_source")
        private String resaleSource;

        @JsonProperty("resale_price")
        private BigDecimal resalePrice;

        @JsonProperty("currency")
        private String currency;

        @JsonProperty("profit")
        private BigDecimal profit;

        @JsonProperty("margin_pct")
        private BigDecimal marginPct;

        @JsonProperty("opportunity_score")
        private BigDecimal opportunityScore;

        @JsonProperty("feasibility_score")
        private Integer feasibilityScore;

        @JsonProperty("risk_level")
        private String riskLevel;

        static Item of(Opportunity o) {
            OpportunityAssessment a = o.getAssessment();
            return Item.builder()
                    .productId(o.getProductId())
                    .size(o.getSizeLabel())
                    .retailSource(o.getRetailSource())
                    .retailPrice(o.getRetailOffer().priceAmount())
                    .resaleSource(o.getResaleSource())
                    .resalePrice(o.getResaleOffer().priceAmount())
                    .currency(o.getCurrency())
                    .profit(o.getProfitAmount())
                    .marginPct(o.getMarginPct())
                    .opportunityScore(o.getOpportunityScore())
                    .feasibilityScore(a != null ? a.getFeasibilityScore() : null)
                    .riskLevel(a != null ? a.getRiskLevel().name() : null)
                    .build();
        }
    }
}
