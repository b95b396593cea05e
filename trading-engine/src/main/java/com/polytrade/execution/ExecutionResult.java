package com.polytrade.execution;

/**
 * Outcome of one order placement. A successful result carries the YES fill price.
 */
public record ExecutionResult(boolean success, double fillPrice, String error) {

    public static ExecutionResult filled(double fillPrice) {
        return new ExecutionResult(true, fillPrice, null);
    }

    public static ExecutionResult failed(String error) {
        return new ExecutionResult(false, Double.NaN, error);
    }
}
