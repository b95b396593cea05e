package com.polytrade.circuit;

public enum CircuitStatus {
    CLOSED,
    OPEN,
    HALF_OPEN
}
