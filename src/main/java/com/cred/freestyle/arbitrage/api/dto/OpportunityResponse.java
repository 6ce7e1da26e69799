package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.Money;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityAssessment;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Response DTO for a ranked opportunity. Money fields are major units.
 *
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpportunityResponse {

    private String productId;
    private String canonicalSizeId;
    private String size;
    private String retailOfferId;
    private String retailSource;
    private BigDecimal retailPrice;
    private String resaleOfferId;
    private String resaleSource;
    private BigDecimal resalePrice;
    private String currency;
    private BigDecimal profit;
    private BigDecimal marginPct;
    private BigDecimal opportunityScore;
    private Integer demandScore;
    private Integer riskScore;
    private String riskLevel;
    private Integer feasibilityScore;
    private Map<String, Object> demandBreakdown;
    private Map<String, Object> riskFactors;

    public static OpportunityResponse fromOpportunity(Opportunity opportunity) {
        OpportunityResponse response = new OpportunityResponse();
        response.setProductId(opportunity.getProductId());
        response.setCanonicalSizeId(opportunity.getCanonicalSizeId());
        response.setSize(opportunity.getSizeLabel());
        response.setRetailOfferId(opportunity.getRetailOffer().getOfferId());
        response.setRetailSource(opportunity.getRetailSource());
        response.setRetailPrice(Money.toMajor(opportunity.getRetailOffer().getPrice(), opportunity.getCurrency()));
        response.setResaleOfferId(opportunity.getResaleOffer().getOfferId());
        response.setResaleSource(opportunity.getResaleSource());
        response.setResalePrice(Money.toMajor(opportunity.getResaleOffer().getPrice(), opportunity.getCurrency()));
        response.setCurrency(opportunity.getCurrency());
        response.setProfit(opportunity.getProfitAmount());
        response.setMarginPct(opportunity.getMarginPct());
        response.setOpportunityScore(opportunity.getOpportunityScore());

        OpportunityAssessment assessment = opportunity.getAssessment();
        if (assessment != null) {
            response.setDemandScore(assessment.getDemandScore());
            response.setRiskScore(assessment.getRiskScore());
            response.setRiskLevel(assessment.getRiskLevel().name());
            response.setFeasibilityScore(assessment.getFeasibilityScore());
            response.setDemandBreakdown(assessment.getDemandBreakdown());
            response.setRiskFactors(assessment.getRiskFactors());
        }
        return response;
    }
}
