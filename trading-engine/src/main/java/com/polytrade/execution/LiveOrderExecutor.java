package com.polytrade.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Real-money executor. Gateway exceptions become failed results.
 */
public final class LiveOrderExecutor implements OrderExecutor {
    private static final Logger logger = LoggerFactory.getLogger(LiveOrderExecutor.class);

    private final OrderGateway gateway;

    public LiveOrderExecutor(OrderGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        logger.warn("⚠️ LIVE order execution enabled - real orders will be placed");
    }

    @Override
    public ExecutionResult execute(OrderRequest request) {
        try {
            OrderGateway.GatewayFill fill = gateway.submit(request);
            if (fill == null || !(fill.fillPrice() > 0 && fill.fillPrice() < 1)) {
                logger.error("Order for {} returned invalid fill: {}", request.marketId(), fill);
                return ExecutionResult.failed("Invalid fill from gateway");
            }
            logger.info("💰 LIVE order {} filled: {} {} ${} @ {}",
                fill.orderId(), request.side(), request.marketId(),
                String.format("%.2f", request.size()),
                String.format("%.4f", fill.fillPrice()));
            return ExecutionResult.filled(fill.fillPrice());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failed("Interrupted while placing order");
        } catch (Exception e) {
            logger.error("Order placement failed for {}: {}", request.marketId(), e.getMessage());
            return ExecutionResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
