package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.Money;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.UpsertResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a stored offer.
 *
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OfferResponse {

    private String offerId;
    private String productId;
    private String source;
    private String sourceNativeId;
    private String offerKind;
    private String canonicalSizeId;
    private String rawSizeStandard;
    private String rawSizeValue;
    private Long price;
    private BigDecimal priceAmount;
    private String currency;
    private Boolean inStock;
    private Integer stockQty;
    private Instant lastSeenAt;

    /**
     * CREATED, UPDATED or UNCHANGED; only set on upsert responses.
     */
    private String outcome;

    public static OfferResponse fromEntity(Offer offer) {
        OfferResponse response = new OfferResponse();
        response.setOfferId(offer.getOfferId());
        response.setProductId(offer.getProductId());
        response.setSource(offer.getSource());
        response.setSourceNativeId(offer.getSourceNativeId());
        response.setOfferKind(offer.getOfferKind().name());
        response.setCanonicalSizeId(offer.getCanonicalSizeId());
        response.setRawSizeStandard(offer.getRawSizeStandard() != null ? offer.getRawSizeStandard().name() : null);
        response.setRawSizeValue(offer.getRawSizeValue());
        response.setPrice(offer.getPrice());
        response.setPriceAmount(Money.toMajor(offer.getPrice(), offer.getCurrency()));
        response.setCurrency(offer.getCurrency());
        response.setInStock(offer.getInStock());
        response.setStockQty(offer.getStockQty());
        response.setLastSeenAt(offer.getLastSeenAt());
        return response;
    }

    public static OfferResponse fromResult(UpsertResult result) {
        OfferResponse response = fromEntity(result.getOffer());
        response.setOutcome(result.getOutcome().name());
        return response;
    }
}
