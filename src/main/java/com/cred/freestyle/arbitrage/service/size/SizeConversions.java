package com.cred.freestyle.arbitrage.service.size;

import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Default linear conversions between size notations, anchored on US sizing.
 *
 * EU = US + gender offset (men 33, women 30.5, youth 32.5)
 * UK = EU - 33.5
 * CM = EU / 1.5 (one decimal)
 * JP = CM
 * KR = CM * 10 (millimetres)
 *
 * @author Arbitrage Team
 */
public final class SizeConversions {

    public static final String DEFAULT_SOURCE = "standard_conversion";

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal TEN = BigDecimal.TEN;
    private static final BigDecimal UK_OFFSET = new BigDecimal("33.5");
    private static final BigDecimal CM_FACTOR = new BigDecimal("1.5");

    private SizeConversions() {
    }

    /**
     * Convert a value in any notation to a US size, unrounded.
     */
    public static BigDecimal toUs(SizeStandard standard, BigDecimal value, Gender gender) {
        switch (standard) {
            case US:
                return value;
            case EU:
                return value.subtract(gender.getEuOffset());
            case UK:
                return value.add(UK_OFFSET).subtract(gender.getEuOffset());
            case CM:
            case JP:
                return value.multiply(CM_FACTOR).subtract(gender.getEuOffset());
            case KR:
                return value.divide(TEN).multiply(CM_FACTOR).subtract(gender.getEuOffset());
            default:
                throw new IllegalArgumentException("Unsupported size standard: " + standard);
        }
    }

    /**
     * Ordinal (US half-steps) of the nearest supported size, HALF_UP.
     */
    public static int toOrdinal(BigDecimal usSize) {
        return usSize.multiply(TWO).setScale(0, RoundingMode.HALF_UP).intValueExact();
    }

    public static BigDecimal usFromOrdinal(int ordinal) {
        return BigDecimal.valueOf(ordinal).divide(TWO).setScale(1, RoundingMode.UNNECESSARY);
    }

    /**
     * Build the default canonical size row for a US size.
     */
    public static CanonicalSize defaultSize(Gender gender, int ordinal) {
        BigDecimal us = usFromOrdinal(ordinal);
        BigDecimal eu = us.add(gender.getEuOffset()).setScale(1, RoundingMode.UNNECESSARY);
        BigDecimal uk = eu.subtract(UK_OFFSET);
        BigDecimal cm = eu.divide(CM_FACTOR, 1, RoundingMode.HALF_UP);
        BigDecimal kr = cm.multiply(TEN).setScale(1, RoundingMode.UNNECESSARY);

        return CanonicalSize.builder()
                .gender(gender)
                .ordinal(ordinal)
                .usSize(us)
                .euSize(eu)
                .ukSize(uk)
                .cmSize(cm)
                .jpSize(cm)
                .krSize(kr)
                .validationSource(DEFAULT_SOURCE)
                .build();
    }
}
