package com.polytrade.scanner;

/**
 * Direction of a prediction-market position.
 * Prices are always quoted as the YES-token probability.
 */
public enum Side {
    /** Buy the YES outcome token. */
    BUY,
    /** Buy the NO outcome token (short YES). */
    SELL;

    /**
     * Side implied by a signed YES edge.
     */
    public static Side fromEdge(double edge) {
        return edge >= 0 ? BUY : SELL;
    }
}
