package com.cred.freestyle.arbitrage.service.alert;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.OpportunityFilter;
import com.cred.freestyle.arbitrage.domain.model.RiskLevel;
import com.cred.freestyle.arbitrage.exception.ConfigurationException;
import com.cred.freestyle.arbitrage.exception.ResourceNotFoundException;
import com.cred.freestyle.arbitrage.repository.AlertRuleRepository;
import com.cred.freestyle.arbitrage.repository.DeliveryRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Alert rule management: validation, defaults, ownership and activation.
 *
 * Rules are owned by the user who created them. Administrators may read and change any rule.
 * Invalid configurations are rejected with ConfigurationException before anything is written.
 *
 * @author Arbitrage Team
 */
@Service
public class AlertRuleService {

    private static final Logger logger = LoggerFactory.getLogger(AlertRuleService.class);

    static final BigDecimal DEFAULT_MIN_MARGIN_PCT = new BigDecimal("10");
    static final BigDecimal DEFAULT_MIN_PROFIT = new BigDecimal("20");
    static final int DEFAULT_MIN_FEASIBILITY = 60;
    static final RiskLevel DEFAULT_MAX_RISK = RiskLevel.MEDIUM;
    static final int DEFAULT_INTERVAL_MINUTES = 15;
    static final int DEFAULT_MAX_OPPORTUNITIES = 10;
    static final String DEFAULT_TIMEZONE = "Europe/Berlin";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Set<String> EXTRA_FILTER_KEYS = Set.of(
            OpportunityFilter.BRAND,
            OpportunityFilter.RETAIL_SOURCE,
            OpportunityFilter.RESALE_SOURCE,
            OpportunityFilter.MIN_DEMAND_SCORE
    );

    private final AlertRuleRepository alertRuleRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;

    public AlertRuleService(
            AlertRuleRepository alertRuleRepository,
            DeliveryRecordRepository deliveryRecordRepository
    ) {
        this.alertRuleRepository = alertRuleRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
    }

    /**
     * Create a rule for the given owner. Unset options take their defaults.
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    @Transactional
    public AlertRule createRule(String ownerId, AlertRule draft) {
        draft.setAlertRuleId(null);
        draft.setOwnerId(ownerId);
        draft.setLastScannedAt(null);
        draft.setLastTriggeredAt(null);
        draft.setTotalAlertsSent(0L);
        draft.setTotalOpportunitiesSent(0L);
        draft.setLastError(null);
        draft.setLastErrorAt(null);
        applyDefaults(draft);
        validate(draft);

        AlertRule saved = alertRuleRepository.save(draft);
        logger.info("Created alert rule {} '{}' for owner {}", saved.getAlertRuleId(), saved.getName(), ownerId);
        return saved;
    }

    /**
     * Replace the configuration of a rule. Bookkeeping fields are kept.
     */
    @Transactional
    public AlertRule updateRule(String alertRuleId, String callerId, boolean admin, AlertRule changes) {
        AlertRule rule = getRule(alertRuleId, callerId, admin);

        rule.setName(changes.getName());
        rule.setDescription(changes.getDescription());
        rule.setMinMarginPct(changes.getMinMarginPct());
        rule.setMinProfit(changes.getMinProfit());
        rule.setMaxBuyPrice(changes.getMaxBuyPrice());
        rule.setMinFeasibilityScore(changes.getMinFeasibilityScore());
        rule.setMaxRiskLevel(changes.getMaxRiskLevel());
        rule.setSourceFilter(changes.getSourceFilter());
        rule.setExtraFilters(changes.getExtraFilters() != null ? new HashMap<>(changes.getExtraFilters()) : new HashMap<>());
        rule.setWebhookUrl(changes.getWebhookUrl());
        rule.setMaxOpportunitiesPerAlert(changes.getMaxOpportunitiesPerAlert());
        rule.setIncludeDemandBreakdown(changes.getIncludeDemandBreakdown());
        rule.setIncludeRiskDetails(changes.getIncludeRiskDetails());
        rule.setIntervalMinutes(changes.getIntervalMinutes());
        rule.setActiveHoursStart(changes.getActiveHoursStart());
        rule.setActiveHoursEnd(changes.getActiveHoursEnd());
        rule.setActiveDays(copyDays(changes.getActiveDays()));
        rule.setTimezone(changes.getTimezone());
        if (changes.getActive() != null) {
            rule.setActive(changes.getActive());
        }
        applyDefaults(rule);
        validate(rule);

        logger.info("Updated alert rule {}", alertRuleId);
        return alertRuleRepository.save(rule);
    }

    @Transactional
    public AlertRule setActive(String alertRuleId, String callerId, boolean admin, boolean active) {
        AlertRule rule = getRule(alertRuleId, callerId, admin);
        rule.setActive(active);
        logger.info("Alert rule {} {}", alertRuleId, active ? "activated" : "deactivated");
        return alertRuleRepository.save(rule);
    }

    @Transactional
    public void deleteRule(String alertRuleId, String callerId, boolean admin) {
        AlertRule rule = getRule(alertRuleId, callerId, admin);
        int records = deliveryRecordRepository.deleteByAlertRule(alertRuleId);
        alertRuleRepository.delete(rule);
        logger.info("Deleted alert rule {} and {} delivery records", alertRuleId, records);
    }

    /**
     * @throws ResourceNotFoundException if the rule does not exist
     * @throws AccessDeniedException if the caller neither owns the rule nor is an administrator
     */
    @Transactional(readOnly = true)
    public AlertRule getRule(String alertRuleId, String callerId, boolean admin) {
        AlertRule rule = alertRuleRepository.findById(alertRuleId)
                .orElseThrow(() -> new ResourceNotFoundException("AlertRule", alertRuleId));
        if (!admin && !rule.getOwnerId().equals(callerId)) {
            throw new AccessDeniedException("Alert rule " + alertRuleId + " belongs to another user");
        }
        return rule;
    }

    @Transactional(readOnly = true)
    public List<AlertRule> listRules(String callerId, boolean admin) {
        return admin
                ? alertRuleRepository.findAllByOrderByCreatedAtAsc()
                : alertRuleRepository.findByOwnerIdOrderByCreatedAtAsc(callerId);
    }

    static void applyDefaults(AlertRule rule) {
        if (rule.getMinMarginPct() == null) {
            rule.setMinMarginPct(DEFAULT_MIN_MARGIN_PCT);
        }
        if (rule.getMinProfit() == null) {
            rule.setMinProfit(DEFAULT_MIN_PROFIT);
        }
        if (rule.getMinFeasibilityScore() == null) {
            rule.setMinFeasibilityScore(DEFAULT_MIN_FEASIBILITY);
        }
        if (rule.getMaxRiskLevel() == null) {
            rule.setMaxRiskLevel(DEFAULT_MAX_RISK);
        }
        if (rule.getIntervalMinutes() == null) {
            rule.setIntervalMinutes(DEFAULT_INTERVAL_MINUTES);
        }
        if (rule.getMaxOpportunitiesPerAlert() == null) {
            rule.setMaxOpportunitiesPerAlert(DEFAULT_MAX_OPPORTUNITIES);
        }
        if (rule.getIncludeDemandBreakdown() == null) {
            rule.setIncludeDemandBreakdown(true);
        }
        if (rule.getIncludeRiskDetails() == null) {
            rule.setIncludeRiskDetails(true);
        }
        if (rule.getTimezone() == null || rule.getTimezone().isBlank()) {
            rule.setTimezone(DEFAULT_TIMEZONE);
        }
        if (rule.getActive() == null) {
            rule.setActive(true);
        }
        Map<String, String> extraFilters = new HashMap<>();
        if (rule.getExtraFilters() != null) {
            rule.getExtraFilters().forEach((key, value) ->
                    extraFilters.put(key == null ? "" : key.trim().toLowerCase(Locale.ROOT), value));
        }
        rule.setExtraFilters(extraFilters);
        if (rule.getActiveDays() == null) {
            rule.setActiveDays(EnumSet.noneOf(DayOfWeek.class));
        }
    }

    /**
     * Check every option and report all violations at once.
     *
     * @throws ConfigurationException if any option is invalid
     */
    static void validate(AlertRule rule) {
        List<String> violations = new ArrayList<>();

        if (rule.getName() == null || rule.getName().isBlank()) {
            violations.add("name is required");
        }
        if (!isPercentage(rule.getMinMarginPct())) {
            violations.add("min_profit_margin must be between 0 and 100");
        }
        if (rule.getMinProfit().signum() < 0) {
            violations.add("min_gross_profit must not be negative");
        }
        if (rule.getMaxBuyPrice() != null && rule.getMaxBuyPrice().signum() <= 0) {
            violations.add("max_buy_price must be positive");
        }
        if (rule.getMinFeasibilityScore() < 0 || rule.getMinFeasibilityScore() > 100) {
            violations.add("min_feasibility_score must be between 0 and 100");
        }
        if (rule.getIntervalMinutes() <= 0) {
            violations.add("alert_frequency_minutes must be greater than 0");
        }
        if (rule.getMaxOpportunitiesPerAlert() < 1 || rule.getMaxOpportunitiesPerAlert() > 100) {
            violations.add("max_opportunities_per_alert must be between 1 and 100");
        }
        if (!isWebhookUrl(rule.getWebhookUrl())) {
            violations.add("webhook_url must be an absolute http(s) URL");
        }
        try {
            ZoneId.of(rule.getTimezone());
        } catch (DateTimeException e) {
            violations.add("timezone '" + rule.getTimezone() + "' is not a valid time zone");
        }
        for (Map.Entry<String, String> entry : rule.getExtraFilters().entrySet()) {
            String key = entry.getKey();
            if (!EXTRA_FILTER_KEYS.contains(key)) {
                violations.add("unknown additional filter '" + entry.getKey() + "'");
            } else if (OpportunityFilter.MIN_DEMAND_SCORE.equals(key) && !isScore(entry.getValue())) {
                violations.add("min_demand_score must be a number between 0 and 100");
            }
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    private static Set<DayOfWeek> copyDays(Set<DayOfWeek> days) {
        Set<DayOfWeek> copy = EnumSet.noneOf(DayOfWeek.class);
        if (days != null) {
            copy.addAll(days);
        }
        return copy;
    }

    private static boolean isPercentage(BigDecimal value) {
        return value.signum() >= 0 && value.compareTo(HUNDRED) <= 0;
    }

    private static boolean isScore(String value) {
        if (value == null) {
            return false;
        }
        try {
            BigDecimal score = new BigDecimal(value.trim());
            return isPercentage(score);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isWebhookUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return uri.isAbsolute() && uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
