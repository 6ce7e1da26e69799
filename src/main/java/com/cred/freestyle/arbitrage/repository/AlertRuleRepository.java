package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for AlertRule entity.
 *
 * Scan bookkeeping goes through atomic UPDATE statements so that concurrent
 * workers and API edits never overwrite each other's counters.
 *
 * @author Arbitrage Team
 */
@Repository
public interface AlertRuleRepository extends JpaRepository<AlertRule, String> {

    List<AlertRule> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    List<AlertRule> findAllByOrderByCreatedAtAsc();

    List<AlertRule> findByActiveTrue();

    /**
     * Claim a rule that was never scanned.
     *
     * @return 1 if this caller won the claim, 0 otherwise
     */
    @Modifying
    @Transactional
    @Query("UPDATE AlertRule r SET r.lastScannedAt = :now " +
           "WHERE r.alertRuleId = :id AND r.active = true AND r.lastScannedAt IS NULL")
    int claimFirstScan(@Param("id") String alertRuleId, @Param("now") Instant now);

    /**
     * Claim a rule by compare-and-set on last_scanned_at.
     *
     * @param alertRuleId Rule ID
     * @param expected last_scanned_at as read when the rule was found due
     * @param now New scan timestamp
     * @return 1 if this caller won the claim, 0 otherwise
     */
    @Modifying
    @Transactional
    @Query("UPDATE AlertRule r SET r.lastScannedAt = :now " +
           "WHERE r.alertRuleId = :id AND r.active = true AND r.lastScannedAt = :expected")
    int claim(
            @Param("id") String alertRuleId,
            @Param("expected") Instant expected,
            @Param("now") Instant now
    );

    /**
     * Record a successful delivery of {@code opportunities} opportunities.
     */
    @Modifying
    @Query("UPDATE AlertRule r SET r.totalAlertsSent = r.totalAlertsSent + 1, " +
           "r.totalOpportunitiesSent = r.totalOpportunitiesSent + :opportunities, " +
           "r.lastTriggeredAt = :at, r.lastError = NULL, r.lastErrorAt = NULL " +
           "WHERE r.alertRuleId = :id")
    int recordDelivery(
            @Param("id") String alertRuleId,
            @Param("opportunities") long opportunities,
            @Param("at") Instant at
    );

    /**
     * Record a failed delivery. Counters and the active flag are left alone.
     */
    @Modifying
    @Query("UPDATE AlertRule r SET r.lastError = :error, r.lastErrorAt = :at " +
           "WHERE r.alertRuleId = :id")
    int recordFailure(
            @Param("id") String alertRuleId,
            @Param("error") String error,
            @Param("at") Instant at
    );
}
