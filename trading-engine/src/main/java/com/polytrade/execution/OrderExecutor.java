package com.polytrade.execution;

/**
 * Places orders on the venue.
 *
 * Implementations should report venue-side rejections as a failed {@link ExecutionResult};
 * thrown exceptions are treated the same way by the caller.
 */
public interface OrderExecutor {

    ExecutionResult execute(OrderRequest request);

    /**
     * True when no real order ever leaves the process.
     */
    default boolean isPaper() {
        return false;
    }
}
