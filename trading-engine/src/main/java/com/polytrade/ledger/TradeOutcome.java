package com.polytrade.ledger;

public enum TradeOutcome {
    WIN,
    LOSS,
    BREAKEVEN;

    private static final double EPSILON = 1e-9;

    public static TradeOutcome of(double realizedPnl) {
        if (realizedPnl > EPSILON) {
            return WIN;
        }
        if (realizedPnl < -EPSILON) {
            return LOSS;
        }
        return BREAKEVEN;
    }
}
