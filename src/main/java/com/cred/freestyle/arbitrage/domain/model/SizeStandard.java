package com.cred.freestyle.arbitrage.domain.model;

import java.util.Locale;

/**
 * Regional size notations understood by the size index.
 *
 * @author Arbitrage Team
 */
public enum SizeStandard {
    US,
    EU,
    UK,
    CM,
    JP,
    KR;

    public static SizeStandard fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Size standard is required");
        }
        try {
            return SizeStandard.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown size standard: " + code, e);
        }
    }
}
