package com.cred.freestyle.arbitrage.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * A buy-side offer and a resale offer for the same product and size where the resale
 * price exceeds the buy price. Derived from current offer state on every read, never stored.
 *
 * @author Arbitrage Team
 */
@Value
@Builder
public class Opportunity {

    /**
     * Ordering used everywhere opportunities are ranked: score desc, profit desc,
     * older retail observation first, then offer ids so the order is total.
     */
    public static final Comparator<Opportunity> RANKING = Comparator
            .comparing(Opportunity::getOpportunityScore, Comparator.reverseOrder())
            .thenComparing(Opportunity::getProfit, Comparator.reverseOrder())
            .thenComparing((Opportunity o) -> o.getRetailOffer().getLastSeenAt())
            .thenComparing((Opportunity o) -> o.getRetailOffer().getOfferId())
            .thenComparing((Opportunity o) -> o.getResaleOffer().getOfferId());

    String productId;

    /**
     * Null for sizeless products.
     */
    String canonicalSizeId;

    /**
     * Human readable size ("US 9 (MEN)"), or null for sizeless products.
     */
    String sizeLabel;

    Offer retailOffer;

    Offer resaleOffer;

    String currency;

    /**
     * Resale minus retail price, minor units.
     */
    long profit;

    /**
     * Profit in major units (scale = currency fraction digits).
     */
    BigDecimal profitAmount;

    /**
     * (resale - retail) / retail * 100, scale 2.
     */
    BigDecimal marginPct;

    /**
     * profitAmount * marginPct / 100, scale 4.
     */
    BigDecimal opportunityScore;

    @With
    OpportunityAssessment assessment;

    public String getRetailSource() {
        return retailOffer.getSource();
    }

    public String getResaleSource() {
        return resaleOffer.getSource();
    }
}
