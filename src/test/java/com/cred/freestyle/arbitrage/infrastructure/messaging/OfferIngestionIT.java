package com.cred.freestyle.arbitrage.infrastructure.messaging;

import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.repository.OfferHistoryRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.test.utils.KafkaTestUtils;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end ingestion: observations published to Kafka land in the offer ledger.
 */
@SpringBootTest(properties = {
    "spring.kafka.listener.auto-startup=true",
    "spring.kafka.consumer.group-id=offer-ingestion-it",
    "arbitrage.ingestion.kafka.concurrency=1"
})
@ActiveProfiles("test")
@Testcontainers
@DisplayName("Offer Ingestion Integration Tests")
class OfferIngestionIT {

    private static final String TOPIC = "offer-observations";

    @Container
    @SuppressWarnings("resource") // Testcontainers manages lifecycle automatically
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"))
            .withEmbeddedZookeeper();

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("arbitrage_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private OfferRepository offerRepository;

    @Autowired
    private OfferHistoryRepository offerHistoryRepository;

    private KafkaTemplate<String, String> kafkaTemplate;

    @BeforeEach
    void setUp() {
        offerHistoryRepository.deleteAll();
        offerRepository.deleteAll();

        Map<String, Object> props = KafkaTestUtils.producerProps(kafka.getBootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        kafkaTemplate = new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(props));
    }

    @AfterEach
    void tearDown() {
        kafkaTemplate.destroy();
    }

    private static String observation(String sourceNativeId, long price, String observedAt) {
        return "{\"productId\":\"yeezy-350-zebra\",\"source\":\"stockx\",\"sourceNativeId\":\"" + sourceNativeId
                + "\",\"offerKind\":\"resale\",\"price\":" + price + ",\"currency\":\"EUR\",\"inStock\":true,"
                + "\"observedAt\":\"" + observedAt + "\"}";
    }

    private Optional<Offer> find(String sourceNativeId) {
        return offerRepository.findAll().stream()
                .filter(offer -> offer.getSourceNativeId().equals(sourceNativeId))
                .findFirst();
    }

    @Test
    @DisplayName("Published observation is upserted into the ledger")
    void publishedObservation_CreatesOffer() {
        // When
        kafkaTemplate.send(TOPIC, "stockx:SX-1", observation("SX-1", 24000, "2026-03-01T10:00:00Z"));

        // Then
        await().atMost(Duration.ofSeconds(60)).untilAsserted(() -> {
            Optional<Offer> offer = find("SX-1");
            assertThat(offer).isPresent();
            assertThat(offer.get().getOfferKind()).isEqualTo(OfferKind.RESALE);
            assertThat(offer.get().getPrice()).isEqualTo(24000L);
            assertThat(offer.get().getSizeKey()).isEqualTo(Offer.SIZELESS);
        });
    }

    @Test
    @DisplayName("Malformed record does not block the rest of the batch")
    void malformedRecord_SkippedAndBatchContinues() {
        // When
        kafkaTemplate.send(TOPIC, "stockx:broken", "{not json");
        kafkaTemplate.send(TOPIC, "stockx:SX-2", observation("SX-2", 21000, "2026-03-01T10:00:00Z"));
        kafkaTemplate.send(TOPIC, "stockx:SX-2", observation("SX-2", 19500, "2026-03-01T11:00:00Z"));

        // Then
        await().atMost(Duration.ofSeconds(60)).untilAsserted(() -> {
            Optional<Offer> offer = find("SX-2");
            assertThat(offer).isPresent();
            assertThat(offer.get().getPrice()).isEqualTo(19500L);
        });
        assertThat(offerHistoryRepository.findByOfferIdOrderByRecordedAtAsc(find("SX-2").orElseThrow().getOfferId()))
                .hasSize(2);
    }
}
