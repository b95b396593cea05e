package com.polytrade.risk;

/**
 * Why the {@link RiskGate} refused a trade, in check order.
 */
public enum RejectReason {
    HALTED("Trading manually halted"),
    DAILY_LOSS("Daily loss limit reached"),
    WEEKLY_LOSS("Weekly loss limit reached"),
    DRAWDOWN("Maximum drawdown reached"),
    MAX_POSITIONS("Maximum open positions reached"),
    PER_MARKET_LIMIT("Maximum positions in this market reached"),
    CONCENTRATION("Market concentration limit reached"),
    BELOW_MIN_SIZE("Allowed size below minimum position size");

    private final String description;

    RejectReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Halts latch until a period rollover or manual clearance; the rest are per-trade.
     */
    public boolean isHalt() {
        return this == HALTED || this == DAILY_LOSS || this == WEEKLY_LOSS || this == DRAWDOWN;
    }
}
