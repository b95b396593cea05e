package com.polytrade.scanner;

import java.util.Objects;

/**
 * A typed trading opportunity produced by the market scanner.
 *
 * @param marketId     market (condition) identifier
 * @param marketTitle  human readable question, used for logging only
 * @param side         BUY (YES) or SELL (NO)
 * @param edge         estimated YES probability minus market-implied YES probability
 * @param confidence   scanner confidence in the estimate, 0..1
 * @param currentPrice YES-token price, strictly between 0 and 1
 * @param liquidity    market liquidity in USDC
 */
public record Opportunity(
    String marketId,
    String marketTitle,
    Side side,
    double edge,
    double confidence,
    double currentPrice,
    double liquidity
) {
    public Opportunity {
        if (marketId == null || marketId.isBlank()) {
            throw new IllegalArgumentException("marketId is required");
        }
        Objects.requireNonNull(side, "side");
        if (!Double.isFinite(edge) || edge <= -1.0 || edge >= 1.0) {
            throw new IllegalArgumentException("edge must be within (-1, 1): " + edge);
        }
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        if (!Double.isFinite(currentPrice) || currentPrice <= 0.0 || currentPrice >= 1.0) {
            throw new IllegalArgumentException("currentPrice must be within (0, 1): " + currentPrice);
        }
        if (!Double.isFinite(liquidity) || liquidity < 0.0) {
            throw new IllegalArgumentException("liquidity must be non-negative: " + liquidity);
        }
        if (marketTitle == null) {
            marketTitle = marketId;
        }
    }

    public Opportunity(String marketId, Side side, double edge, double confidence,
                       double currentPrice, double liquidity) {
        this(marketId, marketId, side, edge, confidence, currentPrice, liquidity);
    }

    /**
     * Estimated probability that the chosen side pays out.
     */
    public double winProbability() {
        return winProbability(edge);
    }

    public double winProbability(double proposedEdge) {
        double yes = currentPrice + proposedEdge;
        double p = side == Side.BUY ? yes : 1.0 - yes;
        return Math.max(0.0, Math.min(1.0, p));
    }

    /**
     * Net odds received on a winning dollar: (1-p)/p for YES, p/(1-p) for NO.
     */
    public double payoutOdds() {
        return side == Side.BUY
            ? (1.0 - currentPrice) / currentPrice
            : currentPrice / (1.0 - currentPrice);
    }

    /**
     * Expected profit per dollar staked. Used to rank opportunities.
     */
    public double expectedValuePerDollar() {
        double p = winProbability();
        return p * payoutOdds() - (1.0 - p);
    }

    public double expectedValue(double stake) {
        return expectedValuePerDollar() * stake;
    }
}
