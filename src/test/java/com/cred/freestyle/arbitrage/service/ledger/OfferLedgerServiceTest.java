package com.cred.freestyle.arbitrage.service.ledger;

import com.cred.freestyle.arbitrage.config.LedgerProperties;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferHistory;
import com.cred.freestyle.arbitrage.domain.model.OfferObservation;
import com.cred.freestyle.arbitrage.domain.model.ResolvedSize;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.cred.freestyle.arbitrage.domain.model.UpsertResult;
import com.cred.freestyle.arbitrage.domain.model.UpsertResult.Outcome;
import com.cred.freestyle.arbitrage.exception.ResourceNotFoundException;
import com.cred.freestyle.arbitrage.exception.SizeNotFoundException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.repository.OfferHistoryRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import com.cred.freestyle.arbitrage.service.size.SizeStandardizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.NOW;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.PRODUCT_ID;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aRetailOffer;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.anObservation;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.canonicalSize;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OfferLedgerService.
 * Repositories are mocked; row locking and ON CONFLICT behaviour are covered by ConcurrentWritesIT.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OfferLedgerService Unit Tests")
class OfferLedgerServiceTest {

    private static final String US9 = "size-men-18";

    @Mock
    private OfferRepository offerRepository;

    @Mock
    private OfferHistoryRepository offerHistoryRepository;

    @Mock
    private SizeStandardizationService sizeService;

    @Mock
    private OpportunityMatcher opportunityMatcher;

    @Mock
    private ArbitrageMetricsService metricsService;

    private LedgerProperties ledgerProperties;

    private OfferLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerProperties = new LedgerProperties();
        ledgerService = new OfferLedgerService(
                offerRepository,
                offerHistoryRepository,
                sizeService,
                opportunityMatcher,
                metricsService,
                ledgerProperties,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private void givenUs9Resolves() {
        when(sizeService.resolve(SizeStandard.US, "9", Gender.MEN, "Nike", null))
                .thenReturn(new ResolvedSize(canonicalSize(Gender.MEN, 18), null, ResolvedSize.Method.DEFAULT_CONVERSION));
    }

    private void givenInsertResult(int inserted) {
        when(offerRepository.insertIfAbsent(anyString(), anyString(), anyString(), anyString(), anyString(),
                anyString(), anyLong(), anyString(), anyBoolean(), any(Instant.class)))
                .thenReturn(inserted);
    }

    private void givenStoredOffer(Offer offer) {
        when(offerRepository.findByNaturalKeyForUpdate(PRODUCT_ID, "awin", "A-123", offer.getSizeKey()))
                .thenReturn(Optional.of(offer));
    }

    // ========================================
    // upsertOffer() Tests
    // ========================================

    @Test
    @DisplayName("upsertOffer - New listing is created with one history row")
    void upsertOffer_NewListing_Created() {
        // Given
        givenUs9Resolves();
        givenInsertResult(1);
        Offer inserted = aRetailOffer(12000).canonicalSizeId(null).build();
        inserted.setSizeKey(US9);
        givenStoredOffer(inserted);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation().build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.CREATED);
        assertThat(result.getOffer().getCanonicalSizeId()).isEqualTo(US9);
        assertThat(result.getOffer().getRawSizeStandard()).isEqualTo(SizeStandard.US);
        assertThat(result.getOffer().getRawSizeValue()).isEqualTo("9");

        ArgumentCaptor<OfferHistory> history = ArgumentCaptor.forClass(OfferHistory.class);
        verify(offerHistoryRepository, times(1)).save(history.capture());
        assertThat(history.getValue().getPrice()).isEqualTo(12000L);
        assertThat(history.getValue().getInStock()).isTrue();
        assertThat(history.getValue().getRecordedAt()).isEqualTo(NOW);

        verify(offerRepository).insertIfAbsent(anyString(), eq(PRODUCT_ID), eq("awin"), eq("A-123"), eq(US9),
                eq("RETAIL"), eq(12000L), eq("EUR"), eq(true), eq(NOW));
        verify(metricsService).recordOfferUpsert("awin", "CREATED");
    }

    @Test
    @DisplayName("upsertOffer - Price change updates in place and appends exactly one history row")
    void upsertOffer_PriceChange_Updated() {
        // Given
        givenUs9Resolves();
        givenInsertResult(0);
        Offer stored = aRetailOffer(12000).canonicalSizeId(US9).lastSeenAt(NOW.minusSeconds(3600)).build();
        givenStoredOffer(stored);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation().price(11000).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.UPDATED);
        assertThat(stored.getPrice()).isEqualTo(11000L);
        assertThat(stored.getLastSeenAt()).isEqualTo(NOW);
        verify(offerRepository).save(stored);

        ArgumentCaptor<OfferHistory> history = ArgumentCaptor.forClass(OfferHistory.class);
        verify(offerHistoryRepository, times(1)).save(history.capture());
        assertThat(history.getValue().getOfferId()).isEqualTo(stored.getOfferId());
        assertThat(history.getValue().getPrice()).isEqualTo(11000L);
    }

    @Test
    @DisplayName("upsertOffer - Re-ingesting unchanged price and stock leaves history untouched")
    void upsertOffer_Unchanged_NoHistory() {
        // Given
        givenUs9Resolves();
        givenInsertResult(0);
        Offer stored = aRetailOffer(12000).canonicalSizeId(US9).lastSeenAt(NOW.minusSeconds(3600)).build();
        givenStoredOffer(stored);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation().build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.UNCHANGED);
        assertThat(stored.getLastSeenAt()).isEqualTo(NOW);
        verify(offerRepository).save(stored);
        verify(offerHistoryRepository, never()).save(any());
    }

    @Test
    @DisplayName("upsertOffer - Observation older than the stored one is ignored")
    void upsertOffer_LateObservation_Ignored() {
        // Given
        givenUs9Resolves();
        givenInsertResult(0);
        Offer stored = aRetailOffer(12000).canonicalSizeId(US9).lastSeenAt(NOW.plusSeconds(60)).build();
        givenStoredOffer(stored);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation().price(9000).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.UNCHANGED);
        assertThat(stored.getPrice()).isEqualTo(12000L);
        verify(offerRepository, never()).save(any());
        verify(offerHistoryRepository, never()).save(any());
    }

    @Test
    @DisplayName("upsertOffer - Unstamped observation applies even if a concurrent writer stamped the row later")
    void upsertOffer_UnstampedAfterConcurrentWriter_Applied() {
        // Given - the row was last written by a writer whose clock read came after ours
        givenInsertResult(0);
        Instant concurrentWrite = NOW.plusMillis(5);
        Offer stored = aRetailOffer(12500).sizeless().lastSeenAt(concurrentWrite).build();
        givenStoredOffer(stored);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation()
                .sizeStandard(null).sizeValue(null).gender(null)
                .price(13000).observedAt(null).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.UPDATED);
        assertThat(stored.getPrice()).isEqualTo(13000L);
        assertThat(stored.getLastSeenAt()).isEqualTo(concurrentWrite);

        ArgumentCaptor<OfferHistory> history = ArgumentCaptor.forClass(OfferHistory.class);
        verify(offerHistoryRepository).save(history.capture());
        assertThat(history.getValue().getPrice()).isEqualTo(13000L);
    }

    @Test
    @DisplayName("upsertOffer - Unstamped observation on an older row is stamped with the current time")
    void upsertOffer_Unstamped_StampedAtLock() {
        // Given
        givenInsertResult(0);
        Offer stored = aRetailOffer(12000).sizeless().lastSeenAt(NOW.minusSeconds(600)).build();
        givenStoredOffer(stored);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation()
                .sizeStandard(null).sizeValue(null).gender(null)
                .price(11000).observedAt(null).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.UPDATED);
        assertThat(stored.getLastSeenAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("upsertOffer - Sizeless listing uses the NONE size key and skips size resolution")
    void upsertOffer_Sizeless() {
        // Given
        givenInsertResult(1);
        Offer inserted = aRetailOffer(3000).sizeless().build();
        givenStoredOffer(inserted);

        // When
        UpsertResult result = ledgerService.upsertOffer(anObservation()
                .sizeStandard(null).sizeValue(null).gender(null).price(3000).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(Outcome.CREATED);
        assertThat(result.getOffer().getCanonicalSizeId()).isNull();
        verify(offerRepository).insertIfAbsent(anyString(), anyString(), anyString(), anyString(), eq(Offer.SIZELESS),
                anyString(), anyLong(), anyString(), anyBoolean(), any(Instant.class));
        verifyNoInteractions(sizeService);
    }

    @Test
    @DisplayName("upsertOffer - Unknown size propagates SizeNotFoundException without writing")
    void upsertOffer_SizeNotFound() {
        // Given
        when(sizeService.resolve(any(), anyString(), any(), any(), any()))
                .thenThrow(new SizeNotFoundException("US", "25", "MEN"));

        // When / Then
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().sizeValue("25").build()))
                .isInstanceOf(SizeNotFoundException.class);
        verifyNoInteractions(offerRepository, offerHistoryRepository);
    }

    @Test
    @DisplayName("upsertOffer - Sized observation without gender is rejected")
    void upsertOffer_MissingGender() {
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().gender(null).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Gender");
    }

    @Test
    @DisplayName("upsertOffer - Non-positive price is rejected")
    void upsertOffer_InvalidPrice() {
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().price(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(offerRepository);
    }

    @Test
    @DisplayName("upsertOffer - Fields longer than their columns are rejected before any write")
    void upsertOffer_OverLongFields_Rejected() {
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().source("s".repeat(51)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("source");
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().productId("p".repeat(101)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("productId");
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().brand("b".repeat(101)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("brand");
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().sizeValue("9".repeat(21)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sizeValue");
        verifyNoInteractions(offerRepository, sizeService);
    }

    @Test
    @DisplayName("upsertOffer - Unknown currency code is rejected")
    void upsertOffer_InvalidCurrency() {
        assertThatThrownBy(() -> ledgerService.upsertOffer(anObservation().currency("XYZW").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("upsertOffer - Additional notations are validated, the primary notation is not")
    void upsertOffer_AdditionalSizesValidated() {
        // Given
        givenUs9Resolves();
        givenInsertResult(0);
        givenStoredOffer(aRetailOffer(12000).canonicalSizeId(US9).lastSeenAt(NOW.minusSeconds(60)).build());

        // When
        ledgerService.upsertOffer(anObservation()
                .additionalSizes(Map.of(SizeStandard.EU, "42", SizeStandard.US, "9", SizeStandard.UK, "n/a"))
                .build());

        // Then
        verify(sizeService).validate(eq(US9), eq(SizeStandard.EU),
                argThat(value -> value.compareTo(new BigDecimal("42")) == 0), eq("awin"));
        verify(sizeService, times(1)).validate(anyString(), any(), any(), anyString());
    }

    // ========================================
    // sweepStaleOffers() Tests
    // ========================================

    @Test
    @DisplayName("sweepStaleOffers - Uses per-source staleness and records history for expired offers")
    void sweepStaleOffers_PerSourceWindow() {
        // Given
        ledgerProperties.getSourceStaleness().put("stockx", Duration.ofHours(6));
        Offer stale = aRetailOffer(12000).lastSeenAt(NOW.minus(Duration.ofHours(30))).build();
        when(offerRepository.findSourcesWithStock()).thenReturn(List.of("awin", "stockx"));
        when(offerRepository.findStaleForUpdate("awin", NOW.minus(Duration.ofHours(24)))).thenReturn(List.of(stale));
        when(offerRepository.findStaleForUpdate("stockx", NOW.minus(Duration.ofHours(6)))).thenReturn(Collections.emptyList());

        // When
        int expired = ledgerService.sweepStaleOffers(NOW);

        // Then
        assertThat(expired).isEqualTo(1);
        assertThat(stale.getInStock()).isFalse();
        verify(offerRepository).save(stale);

        ArgumentCaptor<OfferHistory> history = ArgumentCaptor.forClass(OfferHistory.class);
        verify(offerHistoryRepository).save(history.capture());
        assertThat(history.getValue().getInStock()).isFalse();
        verify(metricsService).recordOffersExpired("awin", 1);
    }

    @Test
    @DisplayName("sweepStaleOffers - Nothing in stock: nothing to do")
    void sweepStaleOffers_NoSources() {
        when(offerRepository.findSourcesWithStock()).thenReturn(Collections.emptyList());

        assertThat(ledgerService.sweepStaleOffers(NOW)).isZero();
        verify(offerHistoryRepository, never()).save(any());
    }

    // ========================================
    // getHistory() Tests
    // ========================================

    @Test
    @DisplayName("getHistory - Unknown offer returns ResourceNotFoundException")
    void getHistory_UnknownOffer() {
        when(offerRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> ledgerService.getHistory("missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("getHistory - Returns rows oldest first")
    void getHistory_Ordered() {
        OfferHistory first = OfferHistory.builder().offerId("OFF-1").price(12000L).recordedAt(NOW.minusSeconds(60)).build();
        OfferHistory second = OfferHistory.builder().offerId("OFF-1").price(11000L).recordedAt(NOW).build();
        when(offerRepository.existsById("OFF-1")).thenReturn(true);
        when(offerHistoryRepository.findByOfferIdOrderByRecordedAtAsc("OFF-1")).thenReturn(List.of(first, second));

        assertThat(ledgerService.getHistory("OFF-1")).containsExactly(first, second);
    }
}
