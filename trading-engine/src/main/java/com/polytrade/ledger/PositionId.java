package com.polytrade.ledger;

/**
 * Ledger-assigned position identifier.
 */
public record PositionId(long value) {
    @Override
    public String toString() {
        return "P-" + value;
    }
}
