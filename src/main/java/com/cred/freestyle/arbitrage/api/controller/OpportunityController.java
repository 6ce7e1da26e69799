package com.cred.freestyle.arbitrage.api.controller;

import com.cred.freestyle.arbitrage.api.dto.OpportunityResponse;
import com.cred.freestyle.arbitrage.domain.model.OpportunityFilter;
import com.cred.freestyle.arbitrage.domain.model.RiskLevel;
import com.cred.freestyle.arbitrage.service.ledger.OfferLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for querying current arbitrage opportunities.
 *
 * @author Arbitrage Team
 */
@RestController
@RequestMapping("/api/v1/opportunities")
public class OpportunityController {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityController.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final OfferLedgerService ledgerService;

    public OpportunityController(OfferLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * Ranked opportunities over the current offer state. Money parameters are major units.
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OpportunityResponse>> listOpportunities(
            @RequestParam(required = false) BigDecimal minMarginPct,
            @RequestParam(required = false) BigDecimal minProfit,
            @RequestParam(required = false) BigDecimal maxBuyPrice,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String productId,
            @RequestParam(required = false) Integer minFeasibilityScore,
            @RequestParam(required = false) RiskLevel maxRiskLevel,
            @RequestParam(required = false) String brand,
            @RequestParam(required = false) String retailSource,
            @RequestParam(required = false) String resaleSource,
            @RequestParam(required = false) Integer minDemandScore,
            @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit
    ) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }

        Map<String, String> extra = new HashMap<>();
        putIfPresent(extra, OpportunityFilter.BRAND, brand);
        putIfPresent(extra, OpportunityFilter.RETAIL_SOURCE, retailSource);
        putIfPresent(extra, OpportunityFilter.RESALE_SOURCE, resaleSource);
        putIfPresent(extra, OpportunityFilter.MIN_DEMAND_SCORE, minDemandScore != null ? minDemandScore.toString() : null);

        OpportunityFilter filter = OpportunityFilter.builder()
                .minMarginPct(minMarginPct)
                .minProfit(minProfit)
                .maxBuyPrice(maxBuyPrice)
                .sourceFilter(source)
                .productId(productId)
                .minFeasibilityScore(minFeasibilityScore)
                .maxRiskLevel(maxRiskLevel)
                .extraFilters(extra)
                .limit(limit)
                .build();

        List<OpportunityResponse> opportunities = ledgerService.listOpportunities(filter)
                .map(OpportunityResponse::fromOpportunity)
                .collect(Collectors.toList());

        logger.debug("Listed {} opportunities", opportunities.size());
        return ResponseEntity.ok(opportunities);
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }
}
