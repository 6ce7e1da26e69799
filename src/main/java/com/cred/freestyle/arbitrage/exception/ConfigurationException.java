package com.cred.freestyle.arbitrage.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when an alert rule configuration is invalid.
 * Raised before anything is persisted; carries every violation found.
 *
 * @author Arbitrage Team
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super(String.format("Invalid alert configuration: %s", String.join("; ", violations)));
        this.violations = Collections.unmodifiableList(violations);
    }

    public ConfigurationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
