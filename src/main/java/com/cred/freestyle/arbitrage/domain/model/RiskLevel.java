package com.cred.freestyle.arbitrage.domain.model;

/**
 * Risk classification of an opportunity, ordered from safest to riskiest.
 *
 * @author Arbitrage Team
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @return true if this level is at most {@code max}
     */
    public boolean isAtMost(RiskLevel max) {
        return max == null || this.ordinal() <= max.ordinal();
    }

    public static RiskLevel fromScore(int riskScore) {
        if (riskScore < 30) {
            return LOW;
        }
        if (riskScore < 60) {
            return MEDIUM;
        }
        return HIGH;
    }
}
