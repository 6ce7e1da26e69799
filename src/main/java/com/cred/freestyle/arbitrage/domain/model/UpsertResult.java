package com.cred.freestyle.arbitrage.domain.model;

import lombok.Value;

/**
 * @author Arbitrage Team
 */
@Value
public class UpsertResult {

    Offer offer;

    Outcome outcome;

    public enum Outcome {
        CREATED,
        UPDATED,
        UNCHANGED
    }
}
