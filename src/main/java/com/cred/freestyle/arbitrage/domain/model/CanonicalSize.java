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
 * Canonical size: one row per physical size per gender, with the value of that size
 * in every supported regional notation.
 *
 * The ordinal is the number of US half-steps (US 9 = 18), so it is totally ordered
 * and monotonic with US sizing within a gender. Rows are created by the seed loader
 * and only changed through conflict reconciliation. They are never deleted.
 *
 * @author Arbitrage Team
 */
@Entity
@Table(name = "canonical_sizes", uniqueConstraints = {
    @UniqueConstraint(name = "uq_canonical_size_gender_ordinal", columnNames = {"gender", "ordinal"})
}, indexes = {
    @Index(name = "idx_canonical_size_gender_us", columnList = "gender, us_size")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalSize {

    @Id
    @Column(name = "canonical_size_id", nullable = false, length = 36)
    private String canonicalSizeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 10)
    private Gender gender;

    /**
     * US half-steps. Anchor of cross-standard equivalence.
     */
    @Column(name = "ordinal", nullable = false)
    private Integer ordinal;

    @Column(name = "us_size", nullable = false, precision = 4, scale = 1)
    private BigDecimal usSize;

    @Column(name = "eu_size", precision = 4, scale = 1)
    private BigDecimal euSize;

    @Column(name = "uk_size", precision = 4, scale = 1)
    private BigDecimal ukSize;

    @Column(name = "cm_size", precision = 4, scale = 1)
    private BigDecimal cmSize;

    @Column(name = "jp_size", precision = 4, scale = 1)
    private BigDecimal jpSize;

    @Column(name = "kr_size", precision = 5, scale = 1)
    private BigDecimal krSize;

    /**
     * Where the current values came from ("standard_conversion", "reconciliation:{reviewer}").
     */
    @Column(name = "validation_source", length = 100)
    private String validationSource;

    @Column(name = "last_validated_at")
    private Instant lastValidatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @PrePersist
    protected void onCreate() {
        if (canonicalSizeId == null) {
            canonicalSizeId = UUID.randomUUID().toString();
        }
    }

    /**
     * Value of this size in the given notation.
     *
     * @param standard Size standard
     * @return Stored value, or null if this size has no value in that notation
     */
    public BigDecimal valueIn(SizeStandard standard) {
        switch (standard) {
            case US:
                return usSize;
            case EU:
                return euSize;
            case UK:
                return ukSize;
            case CM:
                return cmSize;
            case JP:
                return jpSize;
            case KR:
                return krSize;
            default:
                throw new IllegalArgumentException("Unsupported size standard: " + standard);
        }
    }

    /**
     * Overwrite the value in a non-US notation. Only used by reconciliation.
     */
    public void applyValue(SizeStandard standard, BigDecimal value) {
        switch (standard) {
            case EU:
                euSize = value;
                break;
            case UK:
                ukSize = value;
                break;
            case CM:
                cmSize = value;
                break;
            case JP:
                jpSize = value;
                break;
            case KR:
                krSize = value;
                break;
            default:
                throw new IllegalArgumentException("US sizes anchor the ordinal and cannot be reconciled");
        }
    }

    /**
     * Short label used in notifications, e.g. "US 9 (MEN)".
     */
    public String label() {
        return "US " + usSize.stripTrailingZeros().toPlainString() + " (" + gender + ")";
    }
}
