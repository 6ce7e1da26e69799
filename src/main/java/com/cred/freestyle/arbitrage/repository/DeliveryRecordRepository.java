package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.DeliveryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for DeliveryRecord entity.
 *
 * @author Arbitrage Team
 */
@Repository
public interface DeliveryRecordRepository extends JpaRepository<DeliveryRecord, String> {

    /**
     * Fingerprints already delivered for a rule inside the retention window.
     */
    @Query("SELECT d.fingerprint FROM DeliveryRecord d WHERE d.alertRuleId = :alertRuleId " +
           "AND d.sentAt >= :since")
    List<String> findFingerprintsSince(
            @Param("alertRuleId") String alertRuleId,
            @Param("since") Instant since
    );

    Optional<DeliveryRecord> findByAlertRuleIdAndFingerprint(String alertRuleId, String fingerprint);

    long countByAlertRuleId(String alertRuleId);

    @Modifying
    @Query("DELETE FROM DeliveryRecord d WHERE d.sentAt < :cutoff")
    int deleteSentBefore(@Param("cutoff") Instant cutoff);

    @Modifying
    @Query("DELETE FROM DeliveryRecord d WHERE d.alertRuleId = :alertRuleId")
    int deleteByAlertRule(@Param("alertRuleId") String alertRuleId);
}
