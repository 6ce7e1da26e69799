package com.cred.freestyle.arbitrage.testutil;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.domain.model.OfferObservation;
import com.cred.freestyle.arbitrage.domain.model.RiskLevel;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.cred.freestyle.arbitrage.service.size.SizeConversions;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * Test data with sensible defaults. Prices are EUR minor units.
 */
public class TestDataBuilder {

    public static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    public static final String PRODUCT_ID = "dunk-low-panda";

    /**
     * Builder for Offer
     */
    public static class OfferBuilder {
        private String offerId = "OFF-" + UUID.randomUUID();
        private String productId = PRODUCT_ID;
        private String source = "awin";
        private String sourceNativeId = "SRC-" + UUID.randomUUID();
        private String canonicalSizeId = "size-men-18";
        private OfferKind offerKind = OfferKind.RETAIL;
        private long price = 12000;
        private String currency = "EUR";
        private boolean inStock = true;
        private Integer stockQty = 5;
        private String brand = "Nike";
        private Instant lastSeenAt = NOW;

        public OfferBuilder offerId(String offerId) {
            this.offerId = offerId;
            return this;
        }

        public OfferBuilder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public OfferBuilder source(String source) {
            this.source = source;
            return this;
        }

        public OfferBuilder canonicalSizeId(String canonicalSizeId) {
            this.canonicalSizeId = canonicalSizeId;
            return this;
        }

        public OfferBuilder sizeless() {
            this.canonicalSizeId = null;
            return this;
        }

        public OfferBuilder kind(OfferKind offerKind) {
            this.offerKind = offerKind;
            return this;
        }

        public OfferBuilder price(long price) {
            this.price = price;
            return this;
        }

        public OfferBuilder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public OfferBuilder inStock(boolean inStock) {
            this.inStock = inStock;
            return this;
        }

        public OfferBuilder stockQty(Integer stockQty) {
            this.stockQty = stockQty;
            return this;
        }

        public OfferBuilder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public OfferBuilder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Offer build() {
            return Offer.builder()
                    .offerId(offerId)
                    .productId(productId)
                    .source(source)
                    .sourceNativeId(sourceNativeId)
                    .sizeKey(Offer.sizeKeyOf(canonicalSizeId))
                    .canonicalSizeId(canonicalSizeId)
                    .offerKind(offerKind)
                    .price(price)
                    .currency(currency)
                    .inStock(inStock)
                    .stockQty(stockQty)
                    .brand(brand)
                    .lastSeenAt(lastSeenAt)
                    .createdAt(lastSeenAt)
                    .build();
        }
    }

    public static OfferBuilder anOffer() {
        return new OfferBuilder();
    }

    public static OfferBuilder aRetailOffer(long price) {
        return new OfferBuilder().kind(OfferKind.RETAIL).source("awin").price(price);
    }

    public static OfferBuilder aResaleOffer(long price) {
        return new OfferBuilder().kind(OfferKind.RESALE).source("stockx").price(price).stockQty(null);
    }

    /**
     * Observation of a men's US 9 retail listing.
     */
    public static OfferObservation.OfferObservationBuilder anObservation() {
        return OfferObservation.builder()
                .productId(PRODUCT_ID)
                .source("awin")
                .sourceNativeId("A-123")
                .offerKind(OfferKind.RETAIL)
                .price(12000)
                .currency("EUR")
                .inStock(true)
                .stockQty(4)
                .sizeStandard(SizeStandard.US)
                .sizeValue("9")
                .gender(Gender.MEN)
                .brand("Nike")
                .observedAt(NOW);
    }

    /**
     * Default size table for a gender, with ids "size-{gender}-{ordinal}".
     */
    public static List<CanonicalSize> defaultSizes(Gender gender, int fromOrdinal, int toOrdinal) {
        List<CanonicalSize> sizes = new ArrayList<>();
        for (int ordinal = fromOrdinal; ordinal <= toOrdinal; ordinal++) {
            sizes.add(canonicalSize(gender, ordinal));
        }
        return sizes;
    }

    public static CanonicalSize canonicalSize(Gender gender, int ordinal) {
        CanonicalSize size = SizeConversions.defaultSize(gender, ordinal);
        size.setCanonicalSizeId("size-" + gender.name().toLowerCase() + "-" + ordinal);
        size.setVersion(0);
        return size;
    }

    /**
     * Builder for AlertRule
     */
    public static AlertRule.AlertRuleBuilder anAlertRule() {
        return AlertRule.builder()
                .alertRuleId("RULE-" + UUID.randomUUID())
                .ownerId("user-123")
                .name("Dunk flips")
                .minMarginPct(new BigDecimal("20"))
                .minProfit(new BigDecimal("20"))
                .minFeasibilityScore(0)
                .maxRiskLevel(RiskLevel.HIGH)
                .webhookUrl("https://hooks.example.com/arbitrage")
                .maxOpportunitiesPerAlert(10)
                .includeDemandBreakdown(false)
                .includeRiskDetails(false)
                .intervalMinutes(15)
                .timezone("Europe/Berlin")
                .active(true)
                .extraFilters(new HashMap<>())
                .createdAt(NOW.minusSeconds(3600));
    }

    public static AlertRule.AlertRuleBuilder aWindowedRule(LocalTime start, LocalTime end) {
        return anAlertRule().activeHoursStart(start).activeHoursEnd(end);
    }
}
