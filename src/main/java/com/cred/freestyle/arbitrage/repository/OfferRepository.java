package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Offer entity.
 *
 * Upserts are done in two steps inside one transaction:
 * 1. {@link #insertIfAbsent} creates the row if the natural key is free (no-op otherwise)
 * 2. {@link #findByNaturalKeyForUpdate} locks the row, which the caller then compares and updates
 *
 * @author Arbitrage Team
 */
@Repository
public interface OfferRepository extends JpaRepository<Offer, String> {

    /**
     * Insert a new offer unless one with the same natural key exists.
     * Concurrent inserts of the same key resolve to exactly one row. Only non-null
     * columns are written here; descriptive columns are filled in by the caller
     * once the row is locked.
     *
     * @return 1 if inserted, 0 if the key already existed
     */
    @Modifying
    @Query(value = "INSERT INTO offers (offer_id, product_id, source, source_native_id, size_key, " +
            "offer_kind, price, currency, in_stock, last_seen_at, created_at, updated_at, version) " +
            "VALUES (:offerId, :productId, :source, :sourceNativeId, :sizeKey, :offerKind, :price, " +
            ":currency, :inStock, :seenAt, :seenAt, :seenAt, 0) " +
            "ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(
            @Param("offerId") String offerId,
            @Param("productId") String productId,
            @Param("source") String source,
            @Param("sourceNativeId") String sourceNativeId,
            @Param("sizeKey") String sizeKey,
            @Param("offerKind") String offerKind,
            @Param("price") long price,
            @Param("currency") String currency,
            @Param("inStock") boolean inStock,
            @Param("seenAt") Instant seenAt
    );

    /**
     * Find an offer by natural key with a pessimistic write lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Offer o WHERE o.productId = :productId AND o.source = :source " +
           "AND o.sourceNativeId = :sourceNativeId AND o.sizeKey = :sizeKey")
    Optional<Offer> findByNaturalKeyForUpdate(
            @Param("productId") String productId,
            @Param("source") String source,
            @Param("sourceNativeId") String sourceNativeId,
            @Param("sizeKey") String sizeKey
    );

    /**
     * In-stock offers of the given kinds, grouped by product and size for pairing.
     *
     * @param kinds Offer kinds (buy side and sell side)
     * @return Offers ordered by product and size key
     */
    @Query("SELECT o FROM Offer o WHERE o.inStock = true AND o.offerKind IN :kinds " +
           "ORDER BY o.productId, o.sizeKey")
    List<Offer> findMatchable(@Param("kinds") Collection<OfferKind> kinds);

    /**
     * Same as {@link #findMatchable(Collection)} restricted to one product.
     */
    @Query("SELECT o FROM Offer o WHERE o.inStock = true AND o.offerKind IN :kinds " +
           "AND o.productId = :productId ORDER BY o.sizeKey")
    List<Offer> findMatchableForProduct(
            @Param("productId") String productId,
            @Param("kinds") Collection<OfferKind> kinds
    );

    /**
     * Sources that currently have in-stock offers.
     */
    @Query("SELECT DISTINCT o.source FROM Offer o WHERE o.inStock = true")
    List<String> findSourcesWithStock();

    /**
     * In-stock offers of a source not confirmed since the cutoff.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Offer o WHERE o.source = :source AND o.inStock = true " +
           "AND o.lastSeenAt < :cutoff")
    List<Offer> findStaleForUpdate(
            @Param("source") String source,
            @Param("cutoff") Instant cutoff
    );

    /**
     * Number of distinct sources currently listing a product/size on the given side.
     */
    @Query("SELECT COUNT(DISTINCT o.source) FROM Offer o WHERE o.productId = :productId " +
           "AND o.sizeKey = :sizeKey AND o.offerKind = :kind AND o.inStock = true")
    long countSources(
            @Param("productId") String productId,
            @Param("sizeKey") String sizeKey,
            @Param("kind") OfferKind kind
    );

    boolean existsBySizeAliasId(String sizeAliasId);
}
