package com.cred.freestyle.arbitrage.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Latest known price and availability of one product, at one (possibly absent)
 * canonical size, from one source listing.
 *
 * Natural key: (product_id, source, source_native_id, size_key). size_key is the
 * canonical size id, or {@link #SIZELESS} for offers without a size, so sizeless
 * offers are covered by the unique constraint as well.
 *
 * Offers are never deleted. Stale offers are swept to in_stock = false.
 *
 * @author Arbitrage Team
 */
@Entity
@Table(name = "offers", uniqueConstraints = {
    @UniqueConstraint(name = "uq_offer_natural_key",
            columnNames = {"product_id", "source", "source_native_id", "size_key"})
}, indexes = {
    @Index(name = "idx_offer_matching", columnList = "product_id, size_key, in_stock"),
    @Index(name = "idx_offer_source_seen", columnList = "source, in_stock, last_seen_at"),
    @Index(name = "idx_offer_size_alias", columnList = "size_alias_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Offer {

    public static final String SIZELESS = "NONE";

    public static final int MAX_PRODUCT_ID_LENGTH = 100;
    public static final int MAX_SOURCE_LENGTH = 50;
    public static final int MAX_SOURCE_NATIVE_ID_LENGTH = 200;
    public static final int MAX_RAW_SIZE_VALUE_LENGTH = 20;
    public static final int MAX_BRAND_LENGTH = 100;

    @Id
    @Column(name = "offer_id", nullable = false, length = 36)
    private String offerId;

    @Column(name = "product_id", nullable = false, length = MAX_PRODUCT_ID_LENGTH)
    private String productId;

    @Column(name = "source", nullable = false, length = MAX_SOURCE_LENGTH)
    private String source;

    /**
     * Listing id within the source (feed item id, marketplace variant id, ...).
     */
    @Column(name = "source_native_id", nullable = false, length = MAX_SOURCE_NATIVE_ID_LENGTH)
    private String sourceNativeId;

    @Column(name = "size_key", nullable = false, length = 36)
    private String sizeKey;

    @Column(name = "canonical_size_id", length = 36)
    private String canonicalSizeId;

    /**
     * Alias the size was resolved through, if any. Pins the alias against deletion.
     */
    @Column(name = "size_alias_id", length = 36)
    private String sizeAliasId;

    @Enumerated(EnumType.STRING)
    @Column(name = "raw_size_standard", length = 5)
    private SizeStandard rawSizeStandard;

    @Column(name = "raw_size_value", length = MAX_RAW_SIZE_VALUE_LENGTH)
    private String rawSizeValue;

    @Column(name = "brand", length = MAX_BRAND_LENGTH)
    private String brand;

    @Enumerated(EnumType.STRING)
    @Column(name = "offer_kind", nullable = false, length = 20)
    private OfferKind offerKind;

    /**
     * Price in minor currency units (cents).
     */
    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "in_stock", nullable = false)
    private Boolean inStock;

    @Column(name = "stock_qty")
    private Integer stockQty;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @PrePersist
    protected void onCreate() {
        if (offerId == null) {
            offerId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
        if (sizeKey == null) {
            sizeKey = sizeKeyOf(canonicalSizeId);
        }
    }

    public static String sizeKeyOf(String canonicalSizeId) {
        return canonicalSizeId == null ? SIZELESS : canonicalSizeId;
    }

    public boolean isSized() {
        return canonicalSizeId != null;
    }

    public boolean isAvailable() {
        return Boolean.TRUE.equals(inStock);
    }

    /**
     * Apply a fresh observation of this listing.
     *
     * @return true if price, currency or availability changed (a history row is due)
     */
    public boolean applyObservation(long newPrice, String newCurrency, boolean newInStock,
                                    Integer newStockQty, Instant seenAt) {
        boolean changed = !Objects.equals(price, newPrice)
                || !Objects.equals(currency, newCurrency)
                || !Objects.equals(inStock, newInStock);

        this.price = newPrice;
        this.currency = newCurrency;
        this.inStock = newInStock;
        this.stockQty = newStockQty;
        this.lastSeenAt = seenAt;
        this.updatedAt = seenAt;
        return changed;
    }

    /**
     * Mark the offer as no longer confirmed by its source.
     *
     * @return true if it was in stock before
     */
    public boolean expire(Instant at) {
        if (!isAvailable()) {
            return false;
        }
        this.inStock = false;
        this.updatedAt = at;
        return true;
    }

    /**
     * Price in major currency units, e.g. 12000 EUR cents = 120.00.
     */
    public BigDecimal priceAmount() {
        return Money.toMajor(price, currency);
    }
}
