package com.cred.freestyle.arbitrage;

import com.cred.freestyle.arbitrage.config.AssessmentProperties;
import com.cred.freestyle.arbitrage.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the sneaker arbitrage engine.
 *
 * System Overview:
 * - Ingests retail, wholesale and resale offers from feeds (Kafka or REST)
 * - Normalizes sizes across US/EU/UK/CM/JP/KR notations onto canonical sizes
 * - Keeps the latest state of every offer plus its price history
 * - Derives ranked buy-low/sell-high opportunities per product and size
 * - Evaluates per-user alert rules on their own cadence and posts new
 *   opportunities to webhooks, once per opportunity
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: size index, offer ledger, matcher, assessor, alert scanning
 * - Data Access Layer: JPA repositories with row locks and compare-and-set updates
 * - Infrastructure Layer: Kafka ingestion, schedulers, webhook client, CloudWatch metrics
 *
 * @author Arbitrage Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
@EnableConfigurationProperties({LedgerProperties.class, AssessmentProperties.class})
public class ArbitrageAlertingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbitrageAlertingApplication.class, args);
    }
}
