package com.cred.freestyle.arbitrage.api.controller;

import com.cred.freestyle.arbitrage.api.dto.AlertRuleRequest;
import com.cred.freestyle.arbitrage.api.dto.AlertRuleResponse;
import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.security.SecurityUtils;
import com.cred.freestyle.arbitrage.service.alert.AlertRuleService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for alert rule management.
 *
 * Authorization: rules belong to the caller that created them. Admins can read and
 * manage every rule.
 *
 * @author Arbitrage Team
 */
@RestController
@RequestMapping("/api/v1/alerts")
public class AlertRuleController {

    private static final Logger logger = LoggerFactory.getLogger(AlertRuleController.class);

    private final AlertRuleService alertRuleService;

    public AlertRuleController(AlertRuleService alertRuleService) {
        this.alertRuleService = alertRuleService;
    }

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AlertRuleResponse> createRule(@Valid @RequestBody AlertRuleRequest request) {
        String ownerId = SecurityUtils.requireCurrentUserId();
        logger.info("Creating alert rule '{}' for owner {}", request.getName(), ownerId);

        AlertRule rule = alertRuleService.createRule(ownerId, request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(AlertRuleResponse.fromEntity(rule));
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<AlertRuleResponse>> listRules() {
        List<AlertRuleResponse> rules = alertRuleService
                .listRules(SecurityUtils.requireCurrentUserId(), SecurityUtils.isAdmin())
                .stream()
                .map(AlertRuleResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(rules);
    }

    /**
     * Configuration and delivery status (last scan, last error, counters) of one rule.
     */
    @GetMapping("/{ruleId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AlertRuleResponse> getRule(@PathVariable String ruleId) {
        AlertRule rule = alertRuleService.getRule(ruleId, SecurityUtils.requireCurrentUserId(), SecurityUtils.isAdmin());
        return ResponseEntity.ok(AlertRuleResponse.fromEntity(rule));
    }

    @PutMapping("/{ruleId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AlertRuleResponse> updateRule(
            @PathVariable String ruleId,
            @Valid @RequestBody AlertRuleRequest request
    ) {
        AlertRule rule = alertRuleService.updateRule(ruleId, SecurityUtils.requireCurrentUserId(),
                SecurityUtils.isAdmin(), request.toDraft());
        return ResponseEntity.ok(AlertRuleResponse.fromEntity(rule));
    }

    @PatchMapping("/{ruleId}/active")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AlertRuleResponse> setActive(
            @PathVariable String ruleId,
            @RequestParam boolean active
    ) {
        AlertRule rule = alertRuleService.setActive(ruleId, SecurityUtils.requireCurrentUserId(),
                SecurityUtils.isAdmin(), active);
        return ResponseEntity.ok(AlertRuleResponse.fromEntity(rule));
    }

    @DeleteMapping("/{ruleId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deleteRule(@PathVariable String ruleId) {
        alertRuleService.deleteRule(ruleId, SecurityUtils.requireCurrentUserId(), SecurityUtils.isAdmin());
        return ResponseEntity.noContent().build();
    }
}
