package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.OfferHistory;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for the append-only offer history.
 *
 * @author Arbitrage Team
 */
@Repository
public interface OfferHistoryRepository extends JpaRepository<OfferHistory, String> {

    List<OfferHistory> findByOfferIdOrderByRecordedAtAsc(String offerId);

    long countByOfferId(String offerId);

    /**
     * Price history of all offers of one kind for a product and size since a point in time.
     * Feeds the demand and volatility signals.
     */
    @Query("SELECT h FROM OfferHistory h, Offer o WHERE h.offerId = o.offerId " +
           "AND o.productId = :productId AND o.sizeKey = :sizeKey AND o.offerKind = :kind " +
           "AND h.recordedAt >= :since ORDER BY h.recordedAt ASC")
    List<OfferHistory> findPriceHistory(
            @Param("productId") String productId,
            @Param("sizeKey") String sizeKey,
            @Param("kind") OfferKind kind,
            @Param("since") Instant since
    );
}
