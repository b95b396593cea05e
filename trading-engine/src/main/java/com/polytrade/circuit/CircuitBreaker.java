package com.polytrade.circuit;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Failure-isolation wrapper for one external dependency, backed by a resilience4j
 * circuit breaker.
 *
 * CLOSED -> OPEN after {@code failureThreshold} consecutive failures.
 * OPEN -> HALF_OPEN once the cooldown has elapsed; calls before that fail fast with
 * {@link CircuitOpenException} and never reach the dependency.
 * HALF_OPEN admits exactly one trial call: success closes the breaker and resets the
 * failure count, failure re-opens it with a fresh cooldown.
 */
public final class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final Duration cooldown;
    private final Clock clock;
    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant openedAt;
    private volatile Instant cooldownUntil;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        this(name, config(failureThreshold, cooldown), cooldown, clock);
    }

    CircuitBreaker(String name, CircuitBreakerConfig config, Duration cooldown, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cooldown = cooldown;
        this.delegate = new CircuitBreakerStateMachine(name, config, clock);

        delegate.getEventPublisher()
            .onSuccess(event -> consecutiveFailures.set(0))
            .onError(event -> consecutiveFailures.incrementAndGet())
            .onReset(event -> consecutiveFailures.set(0))
            .onStateTransition(event -> onTransition(event.getStateTransition().getToState()));
    }

    /**
     * A count-based window exactly {@code failureThreshold} calls wide that opens only
     * when every call in it failed, i.e. after that many consecutive failures.
     */
    static CircuitBreakerConfig config(int failureThreshold, Duration cooldown) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (cooldown == null || cooldown.toMillis() < 1) {
            throw new IllegalArgumentException("cooldown must be at least 1ms");
        }
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(cooldown)
            // Only failures trip the breaker; the executor enforces its own timeout.
            .slowCallDurationThreshold(Duration.ofDays(1))
            .build();
    }

    /**
     * Execute a call with circuit breaker protection. Exceptions thrown by the call are
     * counted as failures and rethrown unchanged.
     *
     * @throws CircuitOpenException if the breaker is open or the half-open trial is taken
     */
    public <T> T execute(Supplier<T> call) {
        try {
            return delegate.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            boolean halfOpen = delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.HALF_OPEN;
            throw new CircuitOpenException(name, halfOpen ? null : cooldownUntil);
        }
    }

    public void run(Runnable call) {
        execute(() -> {
            call.run();
            return null;
        });
    }

    private void onTransition(io.github.resilience4j.circuitbreaker.CircuitBreaker.State to) {
        switch (to) {
            case OPEN:
            case FORCED_OPEN:
                openedAt = clock.instant();
                cooldownUntil = openedAt.plus(cooldown);
                logger.warn("Circuit breaker '{}' OPEN after {} consecutive failures; retry after {}",
                    name, consecutiveFailures.get(), cooldownUntil);
                break;
            case CLOSED:
                consecutiveFailures.set(0);
                openedAt = null;
                cooldownUntil = null;
                logger.info("Circuit breaker '{}' state changed: -> CLOSED", name);
                break;
            default:
                logger.info("Circuit breaker '{}' state changed: -> {}", name, to);
        }
    }

    /**
     * Current state. An OPEN breaker whose cooldown has elapsed reports HALF_OPEN,
     * since the next call will be admitted as the trial.
     */
    public CircuitBreakerState state() {
        Instant until = cooldownUntil;
        CircuitStatus status;
        switch (delegate.getState()) {
            case OPEN:
            case FORCED_OPEN:
                status = until != null && clock.instant().isAfter(until)
                    ? CircuitStatus.HALF_OPEN
                    : CircuitStatus.OPEN;
                break;
            case HALF_OPEN:
                status = CircuitStatus.HALF_OPEN;
                break;
            default:
                status = CircuitStatus.CLOSED;
        }
        return new CircuitBreakerState(name, status, consecutiveFailures.get(), openedAt, until);
    }

    /**
     * Manually reset the circuit breaker.
     * Call this when you know the dependency is healthy but the circuit is stuck.
     */
    public void reset() {
        logger.info("🔄 Manual circuit breaker reset requested for '{}'", name);
        delegate.reset();
        openedAt = null;
        cooldownUntil = null;
    }

    public String getName() {
        return name;
    }
}
