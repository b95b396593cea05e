package com.polytrade.ledger;

/**
 * Point-in-time copy of the portfolio aggregates.
 * Invariant: {@code peakBalance >= balance}.
 */
public record PortfolioState(
    double balance,
    double peakBalance,
    double realizedPnlTotal,
    double dailyPnl,
    double weeklyPnl,
    int openPositions,
    int closedTrades,
    int consecutiveLosses
) {

    /**
     * Fractional decline from peak, never negative.
     */
    public double drawdown() {
        if (peakBalance <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, (peakBalance - balance) / peakBalance);
    }

    public String getSummary() {
        return String.format(
            "Balance: $%.2f | Peak: $%.2f | P&L: $%+.2f (day $%+.2f, week $%+.2f) | Drawdown: %.2f%% | Open: %d",
            balance, peakBalance, realizedPnlTotal, dailyPnl, weeklyPnl, drawdown() * 100, openPositions);
    }
}
