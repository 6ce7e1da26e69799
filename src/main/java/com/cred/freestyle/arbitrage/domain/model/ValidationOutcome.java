package com.cred.freestyle.arbitrage.domain.model;

/**
 * Result of checking an observed size mapping against the stored canonical size.
 *
 * @author Arbitrage Team
 */
public enum ValidationOutcome {
    /** Within half a size of the stored value. */
    CONFIRMED,
    /** Disagrees with the stored value; queued for reconciliation. */
    CONFLICT,
    /** Nothing stored for that notation; queued for reconciliation. */
    UNVERIFIED
}
