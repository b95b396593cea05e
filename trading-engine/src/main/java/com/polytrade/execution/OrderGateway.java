package com.polytrade.execution;

/**
 * Venue order API used by {@link LiveOrderExecutor}.
 */
public interface OrderGateway {

    /**
     * Submit an order and wait for its fill.
     *
     * @throws Exception on transport or venue errors
     */
    GatewayFill submit(OrderRequest request) throws Exception;

    record GatewayFill(String orderId, double fillPrice) {
    }
}
