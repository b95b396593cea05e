package com.polytrade.config;

import java.util.List;

/**
 * Startup configuration is unusable. Carries every violation found, not just the first.
 */
public class ConfigInvalidException extends RuntimeException {
    private final List<String> violations;

    public ConfigInvalidException(List<String> violations) {
        super("Configuration validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
