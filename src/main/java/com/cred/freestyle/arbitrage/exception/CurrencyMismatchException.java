package com.cred.freestyle.arbitrage.exception;

/**
 * Exception thrown when two offers that would otherwise pair are priced in different currencies.
 * Prices are never converted.
 *
 * @author Arbitrage Team
 */
public class CurrencyMismatchException extends RuntimeException {

    private final String retailOfferId;
    private final String resaleOfferId;
    private final String retailCurrency;
    private final String resaleCurrency;

    public CurrencyMismatchException(String retailOfferId, String retailCurrency,
                                     String resaleOfferId, String resaleCurrency) {
        super(String.format("Currency mismatch: retail offer %s in %s, resale offer %s in %s",
                retailOfferId, retailCurrency, resaleOfferId, resaleCurrency));
        this.retailOfferId = retailOfferId;
        this.resaleOfferId = resaleOfferId;
        this.retailCurrency = retailCurrency;
        this.resaleCurrency = resaleCurrency;
    }

    public String getRetailOfferId() {
        return retailOfferId;
    }

    public String getResaleOfferId() {
        return resaleOfferId;
    }

    public String getRetailCurrency() {
        return retailCurrency;
    }

    public String getResaleCurrency() {
        return resaleCurrency;
    }
}
