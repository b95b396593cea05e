package com.polytrade.circuit;

import java.time.Instant;

/**
 * The dependency is temporarily unavailable; the wrapped call was not attempted.
 */
public class CircuitOpenException extends RuntimeException {
    private final String dependency;
    private final Instant cooldownUntil;

    public CircuitOpenException(String dependency, Instant cooldownUntil) {
        super("Circuit breaker '" + dependency + "' is open"
            + (cooldownUntil != null ? " until " + cooldownUntil : " (trial call in progress)"));
        this.dependency = dependency;
        this.cooldownUntil = cooldownUntil;
    }

    public String getDependency() {
        return dependency;
    }

    public Instant getCooldownUntil() {
        return cooldownUntil;
    }
}
