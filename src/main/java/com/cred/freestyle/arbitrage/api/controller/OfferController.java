package com.cred.freestyle.arbitrage.api.controller;

import com.cred.freestyle.arbitrage.api.dto.BatchOfferResponse;
import com.cred.freestyle.arbitrage.api.dto.OfferBatchRequest;
import com.cred.freestyle.arbitrage.api.dto.OfferHistoryResponse;
import com.cred.freestyle.arbitrage.api.dto.OfferRequest;
import com.cred.freestyle.arbitrage.api.dto.OfferResponse;
import com.cred.freestyle.arbitrage.domain.model.UpsertResult;
import com.cred.freestyle.arbitrage.exception.SizeConflictException;
import com.cred.freestyle.arbitrage.exception.SizeNotFoundException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.service.ledger.OfferLedgerService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST controller for recording offer observations and reading the offer ledger.
 *
 * @author Arbitrage Team
 */
@RestController
@RequestMapping("/api/v1/offers")
public class OfferController {

    private static final Logger logger = LoggerFactory.getLogger(OfferController.class);

    private final OfferLedgerService ledgerService;
    private final ArbitrageMetricsService metricsService;
    private final Validator validator;

    public OfferController(
            OfferLedgerService ledgerService,
            ArbitrageMetricsService metricsService,
            Validator validator
    ) {
        this.ledgerService = ledgerService;
        this.metricsService = metricsService;
        this.validator = validator;
    }

    /**
     * Record one observation. Returns 201 when the offer is new, 200 otherwise.
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OfferResponse> recordOffer(@Valid @RequestBody OfferRequest request) {
        logger.debug("Recording offer {}/{} for product {}",
                request.getSource(), request.getSourceNativeId(), request.getProductId());

        UpsertResult result = ledgerService.upsertOffer(request.toObservation());
        HttpStatus status = result.getOutcome() == UpsertResult.Outcome.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(OfferResponse.fromResult(result));
    }

    /**
     * Record a batch of observations, each in its own transaction.
     *
     * @return Per-record outcome (CREATED, UPDATED, UNCHANGED, INVALID, SIZE_NOT_FOUND, SIZE_CONFLICT)
     */
    @PostMapping("/batch")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BatchOfferResponse> recordOffers(@Valid @RequestBody OfferBatchRequest request) {
        long startTime = System.currentTimeMillis();
        BatchOfferResponse response = new BatchOfferResponse();

        List<OfferRequest> offers = request.getOffers();
        for (int i = 0; i < offers.size(); i++) {
            OfferRequest offer = offers.get(i);
            if (offer == null) {
                response.addRejected(i, "INVALID", "Offer is null");
                continue;
            }
            Set<ConstraintViolation<OfferRequest>> violations = validator.validate(offer);
            if (!violations.isEmpty()) {
                response.addRejected(i, "INVALID", violations.stream()
                        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining("; ")));
                metricsService.recordOfferRejected(offer.getSource() != null ? offer.getSource() : "unknown", "INVALID");
                continue;
            }
            try {
                response.addAccepted(i, OfferResponse.fromResult(ledgerService.upsertOffer(offer.toObservation())));
            } catch (SizeNotFoundException e) {
                response.addRejected(i, "SIZE_NOT_FOUND", e.getMessage());
                metricsService.recordOfferRejected(offer.getSource(), "SIZE_NOT_FOUND");
            } catch (SizeConflictException e) {
                response.addRejected(i, "SIZE_CONFLICT", e.getMessage());
                metricsService.recordOfferRejected(offer.getSource(), "SIZE_CONFLICT");
            } catch (IllegalArgumentException e) {
                response.addRejected(i, "INVALID", e.getMessage());
                metricsService.recordOfferRejected(offer.getSource(), "INVALID");
            } catch (DataIntegrityViolationException e) {
                // Rolled back on its own; other database failures still abort the batch
                logger.warn("Offer {} in batch rejected by the database: {}", i, e.getMostSpecificCause().getMessage());
                response.addRejected(i, "INVALID", "Offer violates a storage constraint");
                metricsService.recordOfferRejected(offer.getSource(), "INVALID");
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordIngestionBatch(offers.size(), response.getRejected(), duration);
        logger.info("Recorded offer batch: size={}, accepted={}, rejected={}, duration={}ms",
                offers.size(), response.getAccepted(), response.getRejected(), duration);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{offerId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OfferResponse> getOffer(@PathVariable String offerId) {
        return ResponseEntity.ok(OfferResponse.fromEntity(ledgerService.getOffer(offerId)));
    }

    /**
     * Price and availability history of one offer, oldest first.
     */
    @GetMapping("/{offerId}/history")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OfferHistoryResponse>> getHistory(@PathVariable String offerId) {
        List<OfferHistoryResponse> history = ledgerService.getHistory(offerId).stream()
                .map(OfferHistoryResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(history);
    }
}
