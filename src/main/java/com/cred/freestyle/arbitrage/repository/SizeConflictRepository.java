package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.SizeConflict;
import com.cred.freestyle.arbitrage.domain.model.SizeConflict.ConflictStatus;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Repository interface for SizeConflict audit entries.
 *
 * @author Arbitrage Team
 */
@Repository
public interface SizeConflictRepository extends JpaRepository<SizeConflict, String> {

    List<SizeConflict> findByStatusOrderByDetectedAtAsc(ConflictStatus status);

    /**
     * Check for an identical open entry, so repeated observations are not queued twice.
     */
    boolean existsByCanonicalSizeIdAndStandardAndObservedValueAndObservedSourceAndStatus(
            String canonicalSizeId,
            SizeStandard standard,
            BigDecimal observedValue,
            String observedSource,
            ConflictStatus status
    );
}
