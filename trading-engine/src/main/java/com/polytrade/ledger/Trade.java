package com.polytrade.ledger;

import com.polytrade.scanner.Side;

import java.time.Instant;

/**
 * Immutable record of a closed position. Append-only once created.
 *
 * @param positionId  position this trade closed; also the idempotence key for metrics
 * @param price       exit (YES) price
 */
public record Trade(
    PositionId positionId,
    String marketId,
    String marketTitle,
    Side side,
    double size,
    double entryPrice,
    double price,
    double realizedPnl,
    Instant timestamp,
    TradeOutcome outcome
) {

    /**
     * Return on the capital committed to the position.
     */
    public double returnOnSize() {
        return size > 0 ? realizedPnl / size : 0.0;
    }
}
