package com.cred.freestyle.arbitrage.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Demand, risk and feasibility signals for an opportunity. All scores are 0-100.
 *
 * @author Arbitrage Team
 */
@Value
@Builder
public class OpportunityAssessment {

    int demandScore;

    int riskScore;

    RiskLevel riskLevel;

    int feasibilityScore;

    Map<String, Object> demandBreakdown;

    Map<String, Object> riskFactors;
}
