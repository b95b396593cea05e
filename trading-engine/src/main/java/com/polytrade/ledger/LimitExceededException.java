package com.polytrade.ledger;

/**
 * Thrown when opening a position would break the total or per-market position caps.
 */
public class LimitExceededException extends RuntimeException {
    public LimitExceededException(String message) {
        super(message);
    }
}
