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
 * Brand and/or category scoped override of the default size conversion.
 * An alias maps (standard, value) directly onto a canonical size.
 *
 * Aliases are immutable: there is no update path, and deletion is refused
 * once an offer was resolved through the alias.
 *
 * @author Arbitrage Team
 */
@Entity
@Table(name = "size_aliases", indexes = {
    @Index(name = "idx_size_alias_lookup", columnList = "from_standard, from_value, gender")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SizeAlias {

    @Id
    @Column(name = "size_alias_id", nullable = false, length = 36, updatable = false)
    private String sizeAliasId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_standard", nullable = false, length = 5, updatable = false)
    private SizeStandard fromStandard;

    @Column(name = "from_value", nullable = false, precision = 5, scale = 2, updatable = false)
    private BigDecimal fromValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 10, updatable = false)
    private Gender gender;

    /**
     * Lower-cased brand, null for category-wide aliases.
     */
    @Column(name = "brand", length = 100, updatable = false)
    private String brand;

    /**
     * Lower-cased category, null for brand-wide aliases.
     */
    @Column(name = "category", length = 100, updatable = false)
    private String category;

    @Column(name = "canonical_size_id", nullable = false, length = 36, updatable = false)
    private String canonicalSizeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (sizeAliasId == null) {
            sizeAliasId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
