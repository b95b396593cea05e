package com.polytrade.ledger;

import com.polytrade.scanner.Side;

import java.time.Instant;

/**
 * A position in one prediction market.
 * Size is USDC notional and entry price is the YES-token price at fill.
 */
public record Position(
    PositionId id,
    String marketId,
    String marketTitle,
    Side side,
    double size,
    double entryPrice,
    Instant openedAt,
    PositionStatus status
) {

    /**
     * Realized P&L if the position were closed at the given YES price.
     * A YES holder owns size/entry shares; a NO holder owns size/(1-entry) shares.
     */
    public double pnlAt(double exitPrice) {
        if (side == Side.BUY) {
            double shares = size / entryPrice;
            return shares * (exitPrice - entryPrice);
        }
        double shares = size / (1.0 - entryPrice);
        return shares * (entryPrice - exitPrice);
    }

    Position closed() {
        return new Position(id, marketId, marketTitle, side, size, entryPrice, openedAt, PositionStatus.CLOSED);
    }
}
