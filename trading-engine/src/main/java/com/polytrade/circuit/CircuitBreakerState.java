package com.polytrade.circuit;

import java.time.Instant;

/**
 * Snapshot of one dependency's breaker. {@code openedAt} and {@code cooldownUntil}
 * are null while the breaker has never opened since the last close.
 */
public record CircuitBreakerState(
    String dependency,
    CircuitStatus status,
    int consecutiveFailures,
    Instant openedAt,
    Instant cooldownUntil
) {
    public static CircuitBreakerState closed(String dependency) {
        return new CircuitBreakerState(dependency, CircuitStatus.CLOSED, 0, null, null);
    }
}
