package com.cred.freestyle.arbitrage.domain.model;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Locale;

/**
 * Conversions between minor currency units (as stored) and major units (as configured and displayed).
 *
 * @author Arbitrage Team
 */
public final class Money {

    private Money() {
    }

    public static int fractionDigits(String currencyCode) {
        int digits = Currency.getInstance(currencyCode).getDefaultFractionDigits();
        return Math.max(digits, 0);
    }

    public static BigDecimal toMajor(long minorUnits, String currencyCode) {
        return BigDecimal.valueOf(minorUnits, fractionDigits(currencyCode));
    }

    /**
     * Validate and normalize an ISO-4217 code.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static String normalizeCurrency(String currencyCode) {
        if (currencyCode == null || currencyCode.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        String code = currencyCode.trim().toUpperCase(Locale.ROOT);
        Currency.getInstance(code);
        return code;
    }
}
