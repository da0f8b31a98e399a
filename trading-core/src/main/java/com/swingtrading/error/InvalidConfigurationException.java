package com.swingtrading.error;

import java.util.List;

/**
 * Configuration failed validation. Fatal: a run never starts with an invalid configuration.
 */
public final class InvalidConfigurationException extends TradingException {
    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Configuration validation failed: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
