package com.polytrade.metrics;

/**
 * Aggregate view over the snapshot history.
 */
public record PerformanceSummary(
    MetricSnapshot latest,
    int totalSnapshots,
    double maxPnl,
    double minPnl,
    double apiSuccessRate,
    double tradeSuccessRate
) {
    public double pnlRange() {
        return maxPnl - minPnl;
    }
}
