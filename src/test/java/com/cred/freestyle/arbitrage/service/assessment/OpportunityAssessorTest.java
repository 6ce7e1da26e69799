package com.cred.freestyle.arbitrage.service.assessment;

import com.cred.freestyle.arbitrage.config.AssessmentProperties;
import com.cred.freestyle.arbitrage.domain.model.OfferHistory;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import com.cred.freestyle.arbitrage.domain.model.OpportunityAssessment;
import com.cred.freestyle.arbitrage.domain.model.RiskLevel;
import com.cred.freestyle.arbitrage.repository.OfferHistoryRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import com.cred.freestyle.arbitrage.service.ledger.OpportunityMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.NOW;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.PRODUCT_ID;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aResaleOffer;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aRetailOffer;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OpportunityAssessor scoring.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OpportunityAssessor Unit Tests")
class OpportunityAssessorTest {

    @Mock
    private OfferHistoryRepository offerHistoryRepository;

    @Mock
    private OfferRepository offerRepository;

    private OpportunityAssessor assessor;

    private Opportunity opportunity;

    @BeforeEach
    void setUp() {
        assessor = new OpportunityAssessor(offerHistoryRepository, offerRepository,
                new AssessmentProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        opportunity = OpportunityMatcher.pair(
                aRetailOffer(12000).build(),
                aResaleOffer(18000).build(),
                "US 9 (MEN)").orElseThrow();
    }

    /**
     * One resale price per week, oldest first, ending this week.
     */
    private static List<OfferHistory> weeklyPrices(String currency, long... prices) {
        List<OfferHistory> history = new ArrayList<>();
        for (int i = 0; i < prices.length; i++) {
            history.add(OfferHistory.builder()
                    .offerId("OFF-S")
                    .price(prices[i])
                    .currency(currency)
                    .inStock(true)
                    .recordedAt(NOW.minus(Duration.ofDays(7L * (prices.length - 1 - i))))
                    .build());
        }
        return history;
    }

    private void givenHistory(List<OfferHistory> history) {
        when(offerHistoryRepository.findPriceHistory(eq(PRODUCT_ID), eq("size-men-18"), eq(OfferKind.RESALE),
                eq(NOW.minus(Duration.ofDays(60))))).thenReturn(history);
        when(offerRepository.countSources(PRODUCT_ID, "size-men-18", OfferKind.RESALE)).thenReturn(2L);
    }

    // ========================================
    // assess
    // ========================================

    @Test
    @DisplayName("assess - No history: neutral demand, weighted risk and feasibility")
    void assess_NoHistory() {
        // Given
        givenHistory(Collections.emptyList());

        // When
        OpportunityAssessment assessment = assessor.assess(opportunity);

        // Then: risk = 0.30*50 + 0.25*50 + 0.20*40 + 0.15*10 + 0.10*40 = 41
        assertThat(assessment.getDemandScore()).isEqualTo(50);
        assertThat(assessment.getRiskScore()).isEqualTo(41);
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(assessment.getFeasibilityScore()).isEqualTo(63);
        assertThat(assessment.getDemandBreakdown())
                .containsEntry("data_points", 0)
                .containsEntry("trend_direction", "stable")
                .containsEntry("resale_sources", 2L);
        assertThat(assessment.getRiskFactors())
                .containsEntry("stock_risk", 40)
                .containsEntry("margin_risk", 10)
                .containsEntry("platform_risk", 40);
    }

    @Test
    @DisplayName("assess - Rising resale prices give high demand")
    void assess_RisingPrices() {
        // Given
        givenHistory(weeklyPrices("EUR", 15000, 16000, 17000, 18000));

        // When
        OpportunityAssessment assessment = assessor.assess(opportunity);

        // Then
        assertThat(assessment.getDemandScore()).isEqualTo(100);
        assertThat(assessment.getDemandBreakdown()).containsEntry("trend_direction", "increasing");
    }

    @Test
    @DisplayName("assess - Falling resale prices give low demand and higher risk")
    void assess_FallingPrices() {
        // Given
        givenHistory(weeklyPrices("EUR", 18000, 17000, 16000, 15000));

        // When
        OpportunityAssessment assessment = assessor.assess(opportunity);

        // Then
        assertThat(assessment.getDemandScore()).isEqualTo(20);
        assertThat(assessment.getDemandBreakdown()).containsEntry("trend_direction", "decreasing");
        assertThat(assessment.getRiskScore()).isGreaterThan(41);
    }

    @Test
    @DisplayName("assess - History in another currency is ignored")
    void assess_OtherCurrencyIgnored() {
        // Given
        givenHistory(weeklyPrices("USD", 15000, 16000, 17000, 18000));

        // When
        OpportunityAssessment assessment = assessor.assess(opportunity);

        // Then
        assertThat(assessment.getDemandScore()).isEqualTo(50);
        assertThat(assessment.getDemandBreakdown()).containsEntry("data_points", 0);
    }

    // ========================================
    // Component scores
    // ========================================

    @Test
    @DisplayName("demandScore - Flat prices are stable")
    void demandScore_Flat() {
        Map<String, Object> breakdown = new LinkedHashMap<>();

        int score = OpportunityAssessor.demandScore(weeklyPrices("EUR", 18000, 18000, 18000), breakdown);

        assertThat(score).isEqualTo(60);
        assertThat(breakdown).containsEntry("trend_direction", "stable").containsEntry("data_points", 3);
    }

    @Test
    @DisplayName("volatilityRisk - Fewer than 3 points is neutral, steady prices are low risk")
    void volatilityRisk() {
        assertThat(OpportunityAssessor.volatilityRisk(List.of(100.0, 200.0))).isEqualTo(50.0);
        assertThat(OpportunityAssessor.volatilityRisk(List.of(100.0, 100.0, 100.0))).isEqualTo(20.0);
        assertThat(OpportunityAssessor.volatilityRisk(List.of(50.0, 100.0, 150.0))).isEqualTo(95.0);
    }

    @Test
    @DisplayName("stockRisk - Scarcer stock is riskier, unknown is medium")
    void stockRisk() {
        assertThat(OpportunityAssessor.stockRisk(null)).isEqualTo(50.0);
        assertThat(OpportunityAssessor.stockRisk(0)).isEqualTo(100.0);
        assertThat(OpportunityAssessor.stockRisk(1)).isEqualTo(80.0);
        assertThat(OpportunityAssessor.stockRisk(3)).isEqualTo(60.0);
        assertThat(OpportunityAssessor.stockRisk(100)).isEqualTo(10.0);
    }

    @Test
    @DisplayName("marginRisk - Decreases as margin grows")
    void marginRisk() {
        assertThat(OpportunityAssessor.marginRisk(60)).isEqualTo(10.0);
        assertThat(OpportunityAssessor.marginRisk(30)).isEqualTo(40.0);
        assertThat(OpportunityAssessor.marginRisk(20)).isEqualTo(60.0);
        assertThat(OpportunityAssessor.marginRisk(0)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("RiskLevel.fromScore - Thresholds 30 and 60")
    void riskLevelThresholds() {
        assertThat(RiskLevel.fromScore(29)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(30)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(59)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(60)).isEqualTo(RiskLevel.HIGH);
    }
}
