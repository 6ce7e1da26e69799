package com.cred.freestyle.arbitrage.domain.model;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Sizing gender of a canonical size.
 * Each gender carries the offset used by the default US to EU conversion.
 *
 * @author Arbitrage Team
 */
public enum Gender {

    MEN(new BigDecimal("33")),
    WOMEN(new BigDecimal("30.5")),
    YOUTH(new BigDecimal("32.5"));

    private final BigDecimal euOffset;

    Gender(BigDecimal euOffset) {
        this.euOffset = euOffset;
    }

    /**
     * EU = US + offset for this gender.
     */
    public BigDecimal getEuOffset() {
        return euOffset;
    }

    /**
     * Parse the gender notations used by feeds ("men", "M", "womens", "GS", "youth", ...).
     *
     * @param code Feed gender code
     * @return Matching gender
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Gender fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Gender is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "M":
            case "MEN":
            case "MENS":
            case "MALE":
            case "UNISEX":
                return MEN;
            case "W":
            case "WMNS":
            case "WOMEN":
            case "WOMENS":
            case "FEMALE":
                return WOMEN;
            case "Y":
            case "GS":
            case "KIDS":
            case "YOUTH":
                return YOUTH;
            default:
                throw new IllegalArgumentException("Unknown gender: " + code);
        }
    }
}
