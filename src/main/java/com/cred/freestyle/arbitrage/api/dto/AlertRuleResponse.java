package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTO for an alert rule, configuration plus delivery status.
 *
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertRuleResponse {

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("owner_id")
    private String ownerId;

    private String name;
    private String description;

    @JsonProperty("min_profit_margin")
    private BigDecimal minProfitMargin;

    @JsonProperty("min_gross_profit")
    private BigDecimal minGrossProfit;

    @JsonProperty("max_buy_price")
    private BigDecimal maxBuyPrice;

    @JsonProperty("min_feasibility_score")
    private Integer minFeasibilityScore;

    @JsonProperty("max_risk_level")
    private String maxRiskLevel;

    @JsonProperty("source_filter")
    private String sourceFilter;

    @JsonProperty("webhook_url")
    private String webhookUrl;

    @JsonProperty("alert_frequency_minutes")
    private Integer alertFrequencyMinutes;

    @JsonProperty("active_hours_start")
    private LocalTime activeHoursStart;

    @JsonProperty("active_hours_end")
    private LocalTime activeHoursEnd;

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

    @JsonProperty("last_scanned_at")
    private Instant lastScannedAt;

    @JsonProperty("last_triggered_at")
    private Instant lastTriggeredAt;

    @JsonProperty("total_alerts_sent")
    private Long totalAlertsSent;

    @JsonProperty("total_opportunities_sent")
    private Long totalOpportunitiesSent;

    @JsonProperty("last_error")
    private String lastError;

    @JsonProperty("last_error_at")
    private Instant lastErrorAt;

    @JsonProperty("created_at")
    private Instant createdAt;

    public static AlertRuleResponse fromEntity(AlertRule rule) {
        AlertRuleResponse response = new AlertRuleResponse();
        response.setRuleId(rule.getAlertRuleId());
        response.setOwnerId(rule.getOwnerId());
        response.setName(rule.getName());
        response.setDescription(rule.getDescription());
        response.setMinProfitMargin(rule.getMinMarginPct());
        response.setMinGrossProfit(rule.getMinProfit());
        response.setMaxBuyPrice(rule.getMaxBuyPrice());
        response.setMinFeasibilityScore(rule.getMinFeasibilityScore());
        response.setMaxRiskLevel(rule.getMaxRiskLevel() != null ? rule.getMaxRiskLevel().name() : null);
        response.setSourceFilter(rule.getSourceFilter());
        response.setWebhookUrl(rule.getWebhookUrl());
        response.setAlertFrequencyMinutes(rule.getIntervalMinutes());
        response.setActiveHoursStart(rule.getActiveHoursStart());
        response.setActiveHoursEnd(rule.getActiveHoursEnd());
        response.setActiveDays(rule.getActiveDays() == null ? List.of() : rule.getActiveDays().stream()
                .sorted()
                .map(DayOfWeek::name)
                .collect(Collectors.toList()));
        response.setTimezone(rule.getTimezone());
        response.setMaxOpportunitiesPerAlert(rule.getMaxOpportunitiesPerAlert());
        response.setIncludeDemandBreakdown(rule.getIncludeDemandBreakdown());
        response.setIncludeRiskDetails(rule.getIncludeRiskDetails());
        response.setAdditionalFilters(rule.getExtraFilters());
        response.setActive(rule.getActive());
        response.setLastScannedAt(rule.getLastScannedAt());
        response.setLastTriggeredAt(rule.getLastTriggeredAt());
        response.setTotalAlertsSent(rule.getTotalAlertsSent());
        response.setTotalOpportunitiesSent(rule.getTotalOpportunitiesSent());
        response.setLastError(rule.getLastError());
        response.setLastErrorAt(rule.getLastErrorAt());
        response.setCreatedAt(rule.getCreatedAt());
        return response;
    }
}
