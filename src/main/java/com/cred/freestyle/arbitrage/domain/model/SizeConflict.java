package com.cred.freestyle.arbitrage.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit entry for a size mapping observed from a source that disagrees with
 * (or is missing from) the stored canonical size. Entries queue for manual
 * reconciliation; the canonical size keeps its value until then.
 *
 * @author Arbitrage Team
 */
@Entity
@Table(name = "size_conflicts", indexes = {
    @Index(name = "idx_size_conflict_status", columnList = "status"),
    @Index(name = "idx_size_conflict_size", columnList = "canonical_size_id, standard")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SizeConflict {

    @Id
    @Column(name = "size_conflict_id", nullable = false, length = 36)
    private String sizeConflictId;

    @Column(name = "canonical_size_id", nullable = false, length = 36)
    private String canonicalSizeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "standard", nullable = false, length = 5)
    private SizeStandard standard;

    /**
     * Value stored on the canonical size when the conflict was detected (null if none).
     */
    @Column(name = "stored_value", precision = 5, scale = 1)
    private BigDecimal storedValue;

    @Column(name = "observed_value", nullable = false, precision = 5, scale = 1)
    private BigDecimal observedValue;

    @Column(name = "observed_source", nullable = false, length = 100)
    private String observedSource;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConflictStatus status;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @PrePersist
    protected void onCreate() {
        if (sizeConflictId == null) {
            sizeConflictId = UUID.randomUUID().toString();
        }
        if (status == null) {
            status = ConflictStatus.PENDING;
        }
    }

    public boolean isPending() {
        return status == ConflictStatus.PENDING;
    }

    public void resolve(ConflictStatus outcome, String reviewer, Instant at) {
        this.status = outcome;
        this.resolvedBy = reviewer;
        this.resolvedAt = at;
    }

    public enum ConflictStatus {
        PENDING,
        ACCEPTED,
        REJECTED
    }
}
