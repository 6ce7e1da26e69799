package com.cred.freestyle.arbitrage.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of an offer state. Written in the same transaction as the
 * offer change it reflects; never updated or deleted.
 *
 * @author Arbitrage Team
 */
@Entity
@Immutable
@Table(name = "offer_history", indexes = {
    @Index(name = "idx_offer_history_offer", columnList = "offer_id, recorded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfferHistory {

    @Id
    @Column(name = "offer_history_id", nullable = false, length = 36, updatable = false)
    private String offerHistoryId;

    @Column(name = "offer_id", nullable = false, length = 36, updatable = false)
    private String offerId;

    @Column(name = "price", nullable = false, updatable = false)
    private Long price;

    @Column(name = "currency", nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "in_stock", nullable = false, updatable = false)
    private Boolean inStock;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (offerHistoryId == null) {
            offerHistoryId = UUID.randomUUID().toString();
        }
    }

    public static OfferHistory snapshotOf(Offer offer, Instant recordedAt) {
        return OfferHistory.builder()
                .offerId(offer.getOfferId())
                .price(offer.getPrice())
                .currency(offer.getCurrency())
                .inStock(offer.getInStock())
                .recordedAt(recordedAt)
                .build();
    }
}
