package com.cred.freestyle.arbitrage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Opportunity assessment settings (prefix: arbitrage.assessment).
 *
 * @author Arbitrage Team
 */
@Data
@ConfigurationProperties(prefix = "arbitrage.assessment")
public class AssessmentProperties {

    /**
     * Days of resale price history used for the demand and volatility signals.
     */
    private int historyDays = 60;

    /**
     * Reliability (0-100) of a source when buying from it, keyed by lower-case source name.
     */
    private Map<String, Integer> platformReliability = defaultReliability();

    private int defaultPlatformReliability = 50;

    public int reliabilityOf(String source) {
        if (source == null) {
            return defaultPlatformReliability;
        }
        return platformReliability.getOrDefault(source.toLowerCase(Locale.ROOT), defaultPlatformReliability);
    }

    private static Map<String, Integer> defaultReliability() {
        Map<String, Integer> reliability = new HashMap<>();
        reliability.put("stockx", 95);
        reliability.put("goat", 90);
        reliability.put("alias", 90);
        reliability.put("ebay", 75);
        reliability.put("klekt", 70);
        reliability.put("awin", 60);
        reliability.put("webgains", 60);
        return reliability;
    }
}
