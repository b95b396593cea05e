package com.polytrade.risk;

/**
 * Immutable risk configuration, built once at startup and passed explicitly
 * to the {@link RiskGate} and the ledger.
 *
 * @param dailyLossLimit        USDC loss per calendar day that halts new entries
 * @param weeklyLossLimit       USDC loss per ISO week that halts new entries
 * @param maxDrawdownPct        fractional drawdown from peak that halts trading (0.20 = 20%)
 * @param minSize               smallest USDC stake that may be approved
 * @param maxSize               largest USDC stake that may be approved
 * @param maxPositionsTotal     cap on simultaneously open positions
 * @param maxPositionsPerMarket cap on open positions in one market
 * @param maxConcentrationPct   max fraction of balance committed to one market
 * @param kellyFraction         multiplier applied to the raw Kelly fraction (0.25 = quarter Kelly)
 */
public record RiskLimits(
    double dailyLossLimit,
    double weeklyLossLimit,
    double maxDrawdownPct,
    double minSize,
    double maxSize,
    int maxPositionsTotal,
    int maxPositionsPerMarket,
    double maxConcentrationPct,
    double kellyFraction
) {
    public RiskLimits {
        if (minSize < 0 || maxSize < minSize) {
            throw new IllegalArgumentException("Require 0 <= minSize <= maxSize");
        }
        if (maxPositionsTotal < 1 || maxPositionsPerMarket < 1) {
            throw new IllegalArgumentException("Position caps must be at least 1");
        }
    }

    /**
     * Defaults of the original agent: $500/day, $2000/week, 20% drawdown, $10-$100 stakes,
     * 10 positions, 1 per market, 30% concentration, quarter Kelly.
     */
    public static RiskLimits defaults() {
        return new RiskLimits(500.0, 2000.0, 0.20, 10.0, 100.0, 10, 1, 0.30, 0.25);
    }
}
