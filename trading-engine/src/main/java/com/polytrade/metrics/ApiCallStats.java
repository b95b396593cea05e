package com.polytrade.metrics;

/**
 * Per-dependency call statistics.
 *
 * @param averageLatencyMs rolling average over recent successful calls
 */
public record ApiCallStats(long calls, long errors, double averageLatencyMs) {

    public double successRate() {
        return calls > 0 ? (double) (calls - errors) / calls : 0.0;
    }
}
