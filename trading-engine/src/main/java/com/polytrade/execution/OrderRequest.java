package com.polytrade.execution;

import com.polytrade.scanner.Side;

/**
 * Order to place on the venue. {@code limitPrice} is the YES price the opportunity was priced at.
 */
public record OrderRequest(String marketId, String marketTitle, Side side, double size, double limitPrice) {
    public OrderRequest {
        if (marketId == null || marketId.isBlank()) {
            throw new IllegalArgumentException("marketId is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
        if (!(size > 0)) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        if (!(limitPrice > 0 && limitPrice < 1)) {
            throw new IllegalArgumentException("limitPrice must be in (0,1): " + limitPrice);
        }
        marketTitle = marketTitle == null ? marketId : marketTitle;
    }
}
