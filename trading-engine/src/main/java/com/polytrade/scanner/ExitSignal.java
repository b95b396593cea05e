package com.polytrade.scanner;

import com.polytrade.ledger.PositionId;

import java.util.Objects;

/**
 * Instruction to close an open position, e.g. because its market resolved.
 */
public record ExitSignal(PositionId positionId, double exitPrice, String reason) {
    public ExitSignal {
        Objects.requireNonNull(positionId, "positionId");
        if (!Double.isFinite(exitPrice) || exitPrice < 0.0 || exitPrice > 1.0) {
            throw new IllegalArgumentException("exitPrice must be within [0, 1]: " + exitPrice);
        }
        if (reason == null || reason.isBlank()) {
            reason = "exit";
        }
    }
}
