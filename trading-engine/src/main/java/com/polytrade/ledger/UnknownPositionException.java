package com.polytrade.ledger;

public class UnknownPositionException extends RuntimeException {
    public UnknownPositionException(PositionId id) {
        super("No open position " + id);
    }
}
