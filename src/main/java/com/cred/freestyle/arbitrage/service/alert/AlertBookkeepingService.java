package com.cred.freestyle.arbitrage.service.alert;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.DeliveryRecord;
import com.cred.freestyle.arbitrage.repository.AlertRuleRepository;
import com.cred.freestyle.arbitrage.repository.DeliveryRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;

/**
 * Writes the outcome of an alert scan. Each method is one transaction, so delivery
 * records and counters are committed together or not at all.
 *
 * @author Arbitrage Team
 */
@Service
public class AlertBookkeepingService {

    private static final Logger logger = LoggerFactory.getLogger(AlertBookkeepingService.class);

    private final AlertRuleRepository alertRuleRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;

    public AlertBookkeepingService(
            AlertRuleRepository alertRuleRepository,
            DeliveryRecordRepository deliveryRecordRepository
    ) {
        this.alertRuleRepository = alertRuleRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
    }

    /**
     * Record a successful delivery: one delivery record per fingerprint, counters
     * incremented, last error cleared.
     */
    @Transactional
    public void recordDelivery(String alertRuleId, Collection<String> fingerprints, Instant sentAt) {
        for (String fingerprint : fingerprints) {
            DeliveryRecord record = deliveryRecordRepository.findByAlertRuleIdAndFingerprint(alertRuleId, fingerprint)
                    .orElseGet(() -> DeliveryRecord.builder()
                            .alertRuleId(alertRuleId)
                            .fingerprint(fingerprint)
                            .build());
            // An expired record being re-sent gets a fresh timestamp
            record.setSentAt(sentAt);
            deliveryRecordRepository.save(record);
        }
        alertRuleRepository.recordDelivery(alertRuleId, fingerprints.size(), sentAt);
        logger.debug("Recorded delivery of {} opportunities for rule {}", fingerprints.size(), alertRuleId);
    }

    /**
     * Record a failed scan. Counters and the active flag are left untouched.
     */
    @Transactional
    public void recordFailure(String alertRuleId, String error, Instant at) {
        alertRuleRepository.recordFailure(alertRuleId, AlertRule.truncateError(error), at);
    }

    /**
     * Remove delivery records older than the cutoff.
     *
     * @return Number of records deleted
     */
    @Transactional
    public int pruneDeliveryRecords(Instant cutoff) {
        return deliveryRecordRepository.deleteSentBefore(cutoff);
    }
}
