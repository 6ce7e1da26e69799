package com.cred.freestyle.arbitrage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Offer ledger settings (prefix: arbitrage.ledger).
 *
 * @author Arbitrage Team
 */
@Data
@ConfigurationProperties(prefix = "arbitrage.ledger")
public class LedgerProperties {

    /**
     * How long an in-stock offer stays valid without being re-observed.
     */
    private Duration defaultStaleness = Duration.ofHours(24);

    /**
     * Per-source overrides, keyed by lower-case source name.
     */
    private Map<String, Duration> sourceStaleness = new HashMap<>();

    public Duration stalenessFor(String source) {
        if (source == null) {
            return defaultStaleness;
        }
        return sourceStaleness.getOrDefault(source.toLowerCase(Locale.ROOT), defaultStaleness);
    }
}
