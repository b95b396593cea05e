package com.polytrade.execution;

import com.polytrade.circuit.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator that puts an {@link OrderExecutor} behind a circuit breaker and a hard timeout.
 *
 * A placement that times out, throws or returns a failed result counts as one breaker
 * failure. The caller always gets an {@link ExecutionResult} except when the breaker is open,
 * in which case {@link com.polytrade.circuit.CircuitOpenException} propagates and the
 * delegate is never called. Placements are never retried.
 *
 * A timed-out placement is cancelled with an interrupt. At most {@value #MAX_IN_FLIGHT}
 * placements run at once; a placement that finds the pool saturated fails immediately.
 */
public final class ResilientOrderExecutor implements OrderExecutor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ResilientOrderExecutor.class);
    static final int MAX_IN_FLIGHT = 4;

    private final OrderExecutor delegate;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final ExecutorService pool;

    public ResilientOrderExecutor(OrderExecutor delegate, CircuitBreaker circuitBreaker, Duration timeout) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
        this.pool = new ThreadPoolExecutor(0, MAX_IN_FLIGHT, 60, TimeUnit.SECONDS,
            new SynchronousQueue<>(), new NamedThreadFactory("order-executor"));
        logger.info("ResilientOrderExecutor initialized (breaker '{}', timeout {} ms)",
            circuitBreaker.getName(), timeout.toMillis());
    }

    @Override
    public ExecutionResult execute(OrderRequest request) {
        try {
            return circuitBreaker.execute(() -> placeWithTimeout(request));
        } catch (ExecutionFailedException e) {
            return ExecutionResult.failed(e.getMessage());
        }
    }

    private ExecutionResult placeWithTimeout(OrderRequest request) {
        ExecutionResult result;
        try {
            result = timeLimiter.executeFutureSupplier(
                () -> pool.submit(() -> delegate.execute(request)));
        } catch (TimeoutException e) {
            logger.error("⏱️ Order for {} timed out after {} ms", request.marketId(),
                timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
            throw new ExecutionFailedException("Order placement timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailedException("Interrupted while placing order", e);
        } catch (Exception e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Order for {} threw: {}", request.marketId(), cause.toString());
            throw new ExecutionFailedException("Order placement error: " + cause.getMessage(), cause);
        }
        if (result == null || !result.success()) {
            String error = result == null ? "No result from executor" : result.error();
            throw new ExecutionFailedException(error);
        }
        return result;
    }

    @Override
    public boolean isPaper() {
        return delegate.isPaper();
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Order executor pool did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
