package com.polytrade.execution;

import com.polytrade.scanner.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated executor for paper trading. Fills every order immediately at the limit price,
 * adjusted by a fixed slippage against the trader.
 */
public final class PaperOrderExecutor implements OrderExecutor {
    private static final Logger logger = LoggerFactory.getLogger(PaperOrderExecutor.class);
    private static final double MIN_PRICE = 0.001;
    private static final double MAX_PRICE = 0.999;

    private final double slippageBps;
    private final AtomicLong orderCount = new AtomicLong();

    public PaperOrderExecutor(double slippageBps) {
        if (slippageBps < 0) {
            throw new IllegalArgumentException("slippageBps must be >= 0");
        }
        this.slippageBps = slippageBps;
    }

    @Override
    public ExecutionResult execute(OrderRequest request) {
        double slip = request.limitPrice() * slippageBps / 10_000.0;
        // Buying YES pays up; buying NO means selling YES lower.
        double fill = request.side() == Side.BUY
            ? request.limitPrice() + slip
            : request.limitPrice() - slip;
        fill = Math.min(MAX_PRICE, Math.max(MIN_PRICE, fill));

        long n = orderCount.incrementAndGet();
        logger.info("📝 [PAPER #{}] {} {} ${} @ {} (limit {})",
            n, request.side(), request.marketId(),
            String.format("%.2f", request.size()),
            String.format("%.4f", fill),
            String.format("%.4f", request.limitPrice()));
        return ExecutionResult.filled(fill);
    }

    @Override
    public boolean isPaper() {
        return true;
    }

    public long getOrderCount() {
        return orderCount.get();
    }
}
