package com.cred.freestyle.arbitrage.infrastructure.messaging;

import com.cred.freestyle.arbitrage.exception.SizeResolutionException;
import com.cred.freestyle.arbitrage.infrastructure.messaging.events.OfferObservationMessage;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.service.ledger.OfferLedgerService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Kafka consumer feeding offer observations into the ledger.
 *
 * Records are processed one by one, each in its own upsert transaction:
 * - malformed JSON, unknown sizes and invalid observations are logged, counted and skipped
 * - a lost database connection aborts the batch without acknowledging it, so Kafka redelivers it
 *   (upserts are idempotent, so records already applied are harmless on redelivery)
 *
 * @author Arbitrage Team
 */
@Service
public class OfferIngestionConsumer {

    private static final Logger logger = LoggerFactory.getLogger(OfferIngestionConsumer.class);

    private final OfferLedgerService ledgerService;
    private final ArbitrageMetricsService metricsService;
    private final ObjectMapper objectMapper;

    public OfferIngestionConsumer(
            OfferLedgerService ledgerService,
            ArbitrageMetricsService metricsService,
            ObjectMapper objectMapper
    ) {
        this.ledgerService = ledgerService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    /**
     * @param records Batch of consumer records
     * @param acknowledgment Manual acknowledgment
     */
    @KafkaListener(
            topics = "${arbitrage.ingestion.kafka.topic:offer-observations}",
            groupId = "${spring.kafka.consumer.group-id:offer-ingestion}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeObservations(List<ConsumerRecord<String, String>> records, Acknowledgment acknowledgment) {
        if (records == null || records.isEmpty()) {
            logger.debug("Received empty batch, skipping processing");
            acknowledge(acknowledgment);
            return;
        }

        long batchStartTime = System.currentTimeMillis();
        int failed = 0;

        for (ConsumerRecord<String, String> record : records) {
            if (!process(record)) {
                failed++;
            }
        }

        acknowledge(acknowledgment);
        long duration = System.currentTimeMillis() - batchStartTime;
        metricsService.recordIngestionBatch(records.size(), failed, duration);
        logger.info("Completed ingestion batch: partition={}, size={}, failed={}, duration={}ms",
                records.get(0).partition(), records.size(), failed, duration);
    }

    /**
     * @return true if the record was applied
     * @throws DataAccessResourceFailureException if the database is unreachable
     */
    boolean process(ConsumerRecord<String, String> record) {
        OfferObservationMessage message;
        try {
            message = objectMapper.readValue(record.value(), OfferObservationMessage.class);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse message from partition {}, offset {}: {}",
                    record.partition(), record.offset(), e.getOriginalMessage());
            metricsService.recordOfferRejected("unknown", "PARSE_ERROR");
            return false;
        }

        String source = message.getSource() != null ? message.getSource() : "unknown";
        try {
            ledgerService.upsertOffer(message.toObservation());
            return true;
        } catch (SizeResolutionException e) {
            logger.warn("Skipping offer {}/{}: {}", source, message.getSourceNativeId(), e.getMessage());
            metricsService.recordOfferRejected(source, "SIZE_NOT_FOUND");
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping invalid offer {}/{} at offset {}: {}",
                    source, message.getSourceNativeId(), record.offset(), e.getMessage());
            metricsService.recordOfferRejected(source, "INVALID");
        } catch (DataAccessResourceFailureException e) {
            logger.error("Database unavailable while ingesting offset {}, batch will be redelivered", record.offset(), e);
            metricsService.recordError("INGESTION_DATABASE_ERROR", "consumeObservations");
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error ingesting offer {}/{} at offset {}", source, message.getSourceNativeId(), record.offset(), e);
            metricsService.recordError("INGESTION_ERROR", "consumeObservations");
        }
        return false;
    }

    private static void acknowledge(Acknowledgment acknowledgment) {
        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
    }
}
