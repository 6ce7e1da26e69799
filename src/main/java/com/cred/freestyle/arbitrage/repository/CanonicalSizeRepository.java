package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for CanonicalSize entity.
 *
 * @author Arbitrage Team
 */
@Repository
public interface CanonicalSizeRepository extends JpaRepository<CanonicalSize, String> {

    /**
     * Find the canonical size at a US half-step ordinal.
     *
     * @param gender Sizing gender
     * @param ordinal US size times two
     * @return Optional containing the size if seeded
     */
    Optional<CanonicalSize> findByGenderAndOrdinal(Gender gender, Integer ordinal);

    /**
     * All sizes of a gender in ascending order.
     */
    List<CanonicalSize> findByGenderOrderByOrdinalAsc(Gender gender);

    /**
     * Find a canonical size with a pessimistic write lock, used by reconciliation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CanonicalSize c WHERE c.canonicalSizeId = :id")
    Optional<CanonicalSize> findByIdForUpdate(@Param("id") String canonicalSizeId);

    /**
     * Nearest smaller and larger sizes of the same gender, used for the monotonicity check.
     */
    Optional<CanonicalSize> findFirstByGenderAndOrdinalLessThanOrderByOrdinalDesc(Gender gender, Integer ordinal);

    Optional<CanonicalSize> findFirstByGenderAndOrdinalGreaterThanOrderByOrdinalAsc(Gender gender, Integer ordinal);
}
