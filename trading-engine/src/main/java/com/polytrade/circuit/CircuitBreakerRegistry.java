package com.polytrade.circuit;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CircuitBreaker} per external dependency name, sharing one resilience4j
 * configuration. Breakers are built on the supplied clock so cooldowns follow it.
 */
public final class CircuitBreakerRegistry {
    private final CircuitBreakerConfig config;
    private final Duration cooldown;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int failureThreshold, Duration cooldown, Clock clock) {
        this.config = CircuitBreaker.config(failureThreshold, cooldown);
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public CircuitBreaker breaker(String dependency) {
        return breakers.computeIfAbsent(dependency, name -> new CircuitBreaker(name, config, cooldown, clock));
    }

    /**
     * State of a dependency's breaker; a dependency never called reports CLOSED.
     */
    public CircuitBreakerState state(String dependency) {
        CircuitBreaker breaker = breakers.get(dependency);
        return breaker != null ? breaker.state() : CircuitBreakerState.closed(dependency);
    }

    public Map<String, CircuitBreakerState> states() {
        Map<String, CircuitBreakerState> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.state()));
        return result;
    }
}
