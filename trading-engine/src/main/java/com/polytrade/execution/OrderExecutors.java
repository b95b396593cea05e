package com.polytrade.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the executor variant once, at startup.
 */
public final class OrderExecutors {
    private static final Logger logger = LoggerFactory.getLogger(OrderExecutors.class);

    private OrderExecutors() {
    }

    /**
     * @param gateway venue gateway; may be null in paper mode
     */
    public static OrderExecutor forMode(boolean paperTrading, double paperSlippageBps, OrderGateway gateway) {
        if (paperTrading) {
            logger.info("Running in PAPER TRADING mode (slippage {} bps)", paperSlippageBps);
            return new PaperOrderExecutor(paperSlippageBps);
        }
        if (gateway == null) {
            throw new IllegalStateException("Live trading requires an order gateway");
        }
        return new LiveOrderExecutor(gateway);
    }
}
