package com.cred.freestyle.arbitrage.domain.model;

/**
 * What kind of market an offer comes from.
 *
 * @author Arbitrage Team
 */
public enum OfferKind {

    /**
     * Shop price, the buy side of a flip.
     */
    RETAIL,

    /**
     * Resale marketplace ask (StockX, GOAT, ...), the sell side of a flip.
     */
    RESALE,

    /**
     * Auction listing. Prices are not firm, so auctions never pair.
     */
    AUCTION,

    /**
     * Wholesale/bulk price, buy side like RETAIL.
     */
    WHOLESALE;

    public boolean isBuySide() {
        return this == RETAIL || this == WHOLESALE;
    }

    public boolean isSellSide() {
        return this == RESALE;
    }
}
