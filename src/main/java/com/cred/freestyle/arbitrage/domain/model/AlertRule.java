package com.cred.freestyle.arbitrage.domain.model;

import com.cred.freestyle.arbitrage.domain.model.converter.DayOfWeekSetConverter;
import com.cred.freestyle.arbitrage.domain.model.converter.StringMapJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A user's standing request to be notified about arbitrage opportunities.
 *
 * Lifecycle per scan: Idle -> Due -> Scanning -> (Delivered | Empty | Failed) -> Idle.
 * The transition into Scanning is a compare-and-set on last_scanned_at
 * (see AlertRuleRepository#claim), so at most one worker scans a rule per cycle.
 *
 * Money thresholds (minProfit, maxBuyPrice) are in major currency units.
 * Percentages are in [0, 100].
 *
 * @author Arbitrage Team
 */
@Entity
@Table(name = "alert_rules", indexes = {
    @Index(name = "idx_alert_rule_owner", columnList = "owner_id"),
    @Index(name = "idx_alert_rule_active", columnList = "active, last_scanned_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    public static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(name = "alert_rule_id", nullable = false, length = 36)
    private String alertRuleId;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    // Filters

    @Column(name = "min_margin_pct", nullable = false, precision = 7, scale = 2)
    private BigDecimal minMarginPct;

    @Column(name = "min_profit", nullable = false, precision = 12, scale = 2)
    private BigDecimal minProfit;

    @Column(name = "max_buy_price", precision = 12, scale = 2)
    private BigDecimal maxBuyPrice;

    @Column(name = "min_feasibility_score", nullable = false)
    private Integer minFeasibilityScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "max_risk_level", nullable = false, length = 10)
    private RiskLevel maxRiskLevel;

    @Column(name = "source_filter", length = 50)
    private String sourceFilter;

    /**
     * Extra filters: brand, retail_source, resale_source, min_demand_score.
     */
    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "extra_filters", length = 2000)
    @Builder.Default
    private Map<String, String> extraFilters = new HashMap<>();

    // Delivery

    @Column(name = "webhook_url", nullable = false, length = 500)
    private String webhookUrl;

    @Column(name = "max_opportunities_per_alert", nullable = false)
    private Integer maxOpportunitiesPerAlert;

    @Column(name = "include_demand_breakdown", nullable = false)
    private Boolean includeDemandBreakdown;

    @Column(name = "include_risk_details", nullable = false)
    private Boolean includeRiskDetails;

    // Schedule

    @Column(name = "interval_minutes", nullable = false)
    private Integer intervalMinutes;

    @Column(name = "active_hours_start")
    private LocalTime activeHoursStart;

    @Column(name = "active_hours_end")
    private LocalTime activeHoursEnd;

    /**
     * Weekdays on which the rule may fire. Empty means every day.
     */
    @Convert(converter = DayOfWeekSetConverter.class)
    @Column(name = "active_days", length = 100)
    @Builder.Default
    private Set<DayOfWeek> activeDays = EnumSet.noneOf(DayOfWeek.class);

    @Column(name = "timezone", nullable = false, length = 50)
    private String timezone;

    @Column(name = "active", nullable = false)
    private Boolean active;

    // Bookkeeping

    @Column(name = "last_scanned_at")
    private Instant lastScannedAt;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "total_alerts_sent", nullable = false)
    @Builder.Default
    private Long totalAlertsSent = 0L;

    @Column(name = "total_opportunities_sent", nullable = false)
    @Builder.Default
    private Long totalOpportunitiesSent = 0L;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "last_error_at")
    private Instant lastErrorAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (alertRuleId == null) {
            alertRuleId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    /**
     * Whether the rule should be scanned at the given instant: active, interval elapsed
     * since the last scan, and inside the active window.
     */
    public boolean isDue(Instant now) {
        if (!isActive()) {
            return false;
        }
        if (lastScannedAt != null
                && now.isBefore(lastScannedAt.plus(Duration.ofMinutes(intervalMinutes)))) {
            return false;
        }
        return isInActiveWindow(now);
    }

    /**
     * Evaluate weekday set and active hours in the rule's own timezone.
     * Bounds are inclusive at minute precision; start after end means the window
     * runs overnight (22:00-06:00).
     */
    public boolean isInActiveWindow(Instant now) {
        ZonedDateTime local = now.atZone(ZoneId.of(timezone));

        if (activeDays != null && !activeDays.isEmpty() && !activeDays.contains(local.getDayOfWeek())) {
            return false;
        }
        if (activeHoursStart == null && activeHoursEnd == null) {
            return true;
        }

        LocalTime time = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        LocalTime start = activeHoursStart != null ? activeHoursStart : LocalTime.MIN;
        LocalTime end = activeHoursEnd != null ? activeHoursEnd : LocalTime.MAX;

        if (!start.isAfter(end)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }

    public static String truncateError(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
