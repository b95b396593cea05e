package com.polytrade.ledger;

public enum PositionStatus {
    OPEN,
    CLOSED
}
