package com.cred.freestyle.arbitrage.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * One observation of a listing as reported by an ingestion feed, before size resolution.
 *
 * @author Arbitrage Team
 */
@Value
@Builder
public class OfferObservation {

    String productId;

    String source;

    String sourceNativeId;

    OfferKind offerKind;

    /**
     * Minor units.
     */
    long price;

    String currency;

    boolean inStock;

    Integer stockQty;

    /**
     * Size notation as published by the source. Null for sizeless products.
     */
    SizeStandard sizeStandard;

    String sizeValue;

    Gender gender;

    String brand;

    String category;

    /**
     * Other notations the source publishes for the same size, checked against the index.
     */
    @Builder.Default
    Map<SizeStandard, String> additionalSizes = Collections.emptyMap();

    Instant observedAt;

    public boolean isSized() {
        return sizeStandard != null && sizeValue != null && !sizeValue.isBlank();
    }
}
