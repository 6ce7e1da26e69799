package com.cred.freestyle.arbitrage.infrastructure.messaging.events;

import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.domain.model.OfferObservation;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Offer observation published by feed importers on the offer-observations topic.
 * Keyed by product id so observations of one product stay ordered.
 *
 * Example:
 * {"productId":"dunk-low-panda","source":"awin","sourceNativeId":"A-123","offerKind":"RETAIL",
 *  "price":12000,"currency":"EUR","inStock":true,"stockQty":4,"sizeStandard":"US",
 *  "sizeValue":"9","gender":"men","brand":"Nike","additionalSizes":{"EU":"42"},
 *  "observedAt":"2026-03-01T10:15:30Z"}
 *
 * @author Arbitrage Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfferObservationMessage {

    private String productId;
    private String source;
    private String sourceNativeId;
    private String offerKind;

    /**
     * Minor units.
     */
    private Long price;
    private String currency;
    private Boolean inStock;
    private Integer stockQty;
    private String sizeStandard;
    private String sizeValue;
    private String gender;
    private String brand;
    private String category;
    private Map<String, String> additionalSizes;
    private Instant observedAt;

    /**
     * Convert to the domain observation.
     *
     * @throws IllegalArgumentException if a required field is missing or an enum code is unknown
     */
    public OfferObservation toObservation() {
        if (price == null) {
            throw new IllegalArgumentException("price is required");
        }
        if (offerKind == null) {
            throw new IllegalArgumentException("offerKind is required");
        }
        Map<SizeStandard, String> additional = new EnumMap<>(SizeStandard.class);
        if (additionalSizes != null) {
            additionalSizes.forEach((standard, value) -> additional.put(SizeStandard.fromCode(standard), value));
        }
        return OfferObservation.builder()
                .productId(productId)
                .source(source)
                .sourceNativeId(sourceNativeId)
                .offerKind(OfferKind.valueOf(offerKind.trim().toUpperCase(Locale.ROOT)))
                .price(price)
                .currency(currency)
                .inStock(inStock == null || inStock)
                .stockQty(stockQty)
                .sizeStandard(sizeStandard != null && !sizeStandard.isBlank() ? SizeStandard.fromCode(sizeStandard) : null)
                .sizeValue(sizeValue)
                .gender(gender != null && !gender.isBlank() ? Gender.fromCode(gender) : null)
                .brand(brand)
                .category(category)
                .additionalSizes(additional)
                .observedAt(observedAt)
                .build();
    }
}
