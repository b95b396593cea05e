package com.polytrade.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable, timestamped view of performance written once per cycle.
 * The field set is fixed; it is the record format of the persisted snapshot stream.
 */
public record MetricSnapshot(
    Instant timestamp,
    double balance,
    double peakBalance,
    PnlFields pnl,
    double winRate,
    Double sharpeRatio,
    TradeCounts trades,
    long marketsScanned,
    long opportunitiesFound,
    int consecutiveLosses,
    boolean halted,
    Map<String, ApiCallStats> apiCalls
) {
    public MetricSnapshot {
        apiCalls = apiCalls == null ? Map.of() : Map.copyOf(apiCalls);
    }

    public record PnlFields(double realized, double daily, double weekly, double drawdown) {
    }

    public record TradeCounts(
        long closed,
        long wins,
        long losses,
        long breakevens,
        int open,
        long executed,
        long failed,
        long rejected
    ) {
    }
}
