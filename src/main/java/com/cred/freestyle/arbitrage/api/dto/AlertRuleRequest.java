package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for creating or replacing an alert rule.
 *
 * Unset options take the service defaults. Range checks on the options are done by
 * AlertRuleService so that the same rules apply to every entry point.
 *
 * @author Arbitrage Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    @JsonProperty("min_profit_margin")
    private BigDecimal minProfitMargin;

    @JsonProperty("min_gross_profit")
    private BigDecimal minGrossProfit;

    @JsonProperty("max_buy_price")
    private BigDecimal maxBuyPrice;

    @JsonProperty("min_feasibility_score")
    private Integer minFeasibilityScore;

    /**
     * LOW, MEDIUM or HIGH.
     */
    @JsonProperty("max_risk_level")
    private String maxRiskLevel;

    @JsonProperty("source_filter")
    private String sourceFilter;

    @NotBlank(message = "Webhook URL is required")
    @JsonProperty("webhook_url")
    private String webhookUrl;

    @JsonProperty("alert_frequency_minutes")
    private Integer alertFrequencyMinutes;

    @JsonProperty("active_hours_start")
    private LocalTime activeHoursStart;

    @JsonProperty("active_hours_end")
    private LocalTime activeHoursEnd;

    /**
     * Weekday names (MONDAY..SUNDAY or MON..SUN). Empty means every day.
     */
    @JsonProperty("active_days")
    private List<String> activeDays;

    private String timezone;

    @JsonProperty("max_opportunities_per_alert")
    private Integer maxOpportunitiesPerAlert;

    @JsonProperty("include_demand_breakdown")
    private Boolean includeDemandBreakdown;

    @JsonProperty("include_risk_details")
    private Boolean includeRiskDetails;

    @JsonProperty("additional_filters")
    private Map<String, String> additionalFilters;

    private Boolean active;

    /**
     * @throws IllegalArgumentException if the risk level or a weekday cannot be parsed
     */
    public AlertRule toDraft() {
        return AlertRule.builder()
                .name(name)
                .description(description)
                .minMarginPct(minProfitMargin)
                .minProfit(minGrossProfit)
                .maxBuyPrice(maxBuyPrice)
                .minFeasibilityScore(minFeasibilityScore)
                .maxRiskLevel(maxRiskLevel != null ? RiskLevel.valueOf(maxRiskLevel.trim().toUpperCase(Locale.ROOT)) : null)
                .sourceFilter(sourceFilter)
                .webhookUrl(webhookUrl)
                .intervalMinutes(alertFrequencyMinutes)
                .activeHoursStart(activeHoursStart)
                .activeHoursEnd(activeHoursEnd)
                .activeDays(parseDays(activeDays))
                .timezone(timezone)
                .maxOpportunitiesPerAlert(maxOpportunitiesPerAlert)
                .includeDemandBreakdown(includeDemandBreakdown)
                .includeRiskDetails(includeRiskDetails)
                .extraFilters(additionalFilters != null ? new HashMap<>(additionalFilters) : new HashMap<>())
                .active(active)
                .build();
    }

    static Set<DayOfWeek> parseDays(List<String> days) {
        Set<DayOfWeek> parsed = EnumSet.noneOf(DayOfWeek.class);
        if (days == null) {
            return parsed;
        }
        for (String day : days) {
            String code = day.trim().toUpperCase(Locale.ROOT);
            DayOfWeek match = null;
            for (DayOfWeek candidate : DayOfWeek.values()) {
                if (candidate.name().equals(code) || candidate.name().startsWith(code) && code.length() == 3) {
                    match = candidate;
                    break;
                }
            }
            if (match == null) {
                throw new IllegalArgumentException("Unknown weekday: " + day);
            }
            parsed.add(match);
        }
        return parsed;
    }
}
