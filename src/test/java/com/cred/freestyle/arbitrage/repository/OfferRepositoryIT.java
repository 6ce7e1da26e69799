package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.NOW;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.PRODUCT_ID;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aResaleOffer;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aRetailOffer;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for OfferRepository using Testcontainers.
 * The upsert relies on PostgreSQL's ON CONFLICT, so these run against a real PostgreSQL database.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("OfferRepository Integration Tests")
class OfferRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("arbitrage_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private OfferRepository offerRepository;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void setUp() {
        offerRepository.deleteAll();
    }

    private int insert(String sourceNativeId, String sizeKey, long price) {
        return offerRepository.insertIfAbsent(UUID.randomUUID().toString(), PRODUCT_ID, "awin",
                sourceNativeId, sizeKey, OfferKind.RETAIL.name(), price, "EUR", true, NOW);
    }

    // ========================================
    // insertIfAbsent Tests
    // ========================================

    @Test
    @DisplayName("insertIfAbsent - Second insert of the same natural key is a no-op")
    void insertIfAbsent_SameKey_InsertsOnce() {
        // When
        int first = insert("A-123", "size-men-18", 12000);
        int second = insert("A-123", "size-men-18", 9900);

        // Then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        entityManager.clear();
        Optional<Offer> stored = offerRepository.findByNaturalKeyForUpdate(PRODUCT_ID, "awin", "A-123", "size-men-18");
        assertThat(stored).isPresent();
        assertThat(stored.get().getPrice()).isEqualTo(12000L);
        assertThat(stored.get().getVersion()).isZero();
        assertThat(offerRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("insertIfAbsent - Same listing in two sizes, and a sizeless listing, are distinct offers")
    void insertIfAbsent_DifferentSizeKeys() {
        // When
        insert("A-123", "size-men-18", 12000);
        insert("A-123", "size-men-19", 12000);
        insert("A-123", Offer.SIZELESS, 12000);

        // Then
        assertThat(offerRepository.count()).isEqualTo(3);
    }

    // ========================================
    // findMatchable Tests
    // ========================================

    @Test
    @DisplayName("findMatchable - Only in-stock offers of the requested kinds")
    void findMatchable_FiltersStockAndKind() {
        // Given
        offerRepository.save(aRetailOffer(12000).offerId("OFF-1").build());
        offerRepository.save(aResaleOffer(18000).offerId("OFF-2").build());
        offerRepository.save(aRetailOffer(11000).offerId("OFF-3").inStock(false).build());
        offerRepository.save(aRetailOffer(11000).offerId("OFF-4").kind(OfferKind.AUCTION).build());
        entityManager.flush();

        // When
        List<Offer> matchable = offerRepository.findMatchable(EnumSet.of(OfferKind.RETAIL, OfferKind.RESALE));

        // Then
        assertThat(matchable).extracting(Offer::getOfferId).containsExactlyInAnyOrder("OFF-1", "OFF-2");
    }

    @Test
    @DisplayName("findMatchableForProduct - Restricted to one product")
    void findMatchableForProduct() {
        // Given
        offerRepository.save(aRetailOffer(12000).offerId("OFF-1").build());
        offerRepository.save(aRetailOffer(12000).offerId("OFF-2").productId("jordan-1-chicago").build());
        entityManager.flush();

        // When
        List<Offer> matchable = offerRepository.findMatchableForProduct("jordan-1-chicago", EnumSet.of(OfferKind.RETAIL));

        // Then
        assertThat(matchable).extracting(Offer::getOfferId).containsExactly("OFF-2");
    }

    // ========================================
    // Staleness Tests
    // ========================================

    @Test
    @DisplayName("findStaleForUpdate - In-stock offers of the source last seen before the cutoff")
    void findStaleForUpdate() {
        // Given
        offerRepository.save(aResaleOffer(18000).offerId("OFF-OLD").lastSeenAt(NOW.minus(Duration.ofHours(7))).build());
        offerRepository.save(aResaleOffer(18000).offerId("OFF-NEW").lastSeenAt(NOW.minus(Duration.ofHours(1))).build());
        offerRepository.save(aResaleOffer(18000).offerId("OFF-GONE").inStock(false)
                .lastSeenAt(NOW.minus(Duration.ofDays(3))).build());
        offerRepository.save(aRetailOffer(12000).offerId("OFF-OTHER").lastSeenAt(NOW.minus(Duration.ofDays(3))).build());
        entityManager.flush();

        // When
        List<Offer> stale = offerRepository.findStaleForUpdate("stockx", NOW.minus(Duration.ofHours(6)));

        // Then
        assertThat(stale).extracting(Offer::getOfferId).containsExactly("OFF-OLD");
        assertThat(offerRepository.findSourcesWithStock()).containsExactlyInAnyOrder("stockx", "awin");
    }

    @Test
    @DisplayName("countSources - Distinct in-stock sources on one side of a size")
    void countSources() {
        // Given
        offerRepository.save(aResaleOffer(18000).offerId("OFF-1").build());
        offerRepository.save(aResaleOffer(18500).offerId("OFF-2").build());
        offerRepository.save(aResaleOffer(19000).offerId("OFF-3").source("goat").build());
        entityManager.flush();

        // When / Then
        assertThat(offerRepository.countSources(PRODUCT_ID, "size-men-18", OfferKind.RESALE)).isEqualTo(2);
    }
}
