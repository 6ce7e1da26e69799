package com.cred.freestyle.arbitrage.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof that an opportunity (by fingerprint) was delivered for an alert rule.
 * Kept for the retention window, then pruned.
 *
 * @author Arbitrage Team
 */
@Entity
@Table(name = "delivery_records", uniqueConstraints = {
    @UniqueConstraint(name = "uq_delivery_alert_fingerprint", columnNames = {"alert_rule_id", "fingerprint"})
}, indexes = {
    @Index(name = "idx_delivery_sent_at", columnList = "sent_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryRecord {

    @Id
    @Column(name = "delivery_record_id", nullable = false, length = 36)
    private String deliveryRecordId;

    @Column(name = "alert_rule_id", nullable = false, length = 36)
    private String alertRuleId;

    /**
     * SHA-256 hex, see OpportunityFingerprinter.
     */
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @PrePersist
    protected void onCreate() {
        if (deliveryRecordId == null) {
            deliveryRecordId = UUID.randomUUID().toString();
        }
    }
}
