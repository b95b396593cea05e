package com.polytrade.risk;

import com.polytrade.scanner.Opportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fractional Kelly stake for a binary prediction-market outcome.
 *
 * Kelly % = (b * p - q) / b, where b is the net payout odds of the chosen side,
 * p the estimated win probability and q = 1 - p. The result is scaled by the configured
 * Kelly fraction and the scanner confidence, then applied to the current balance.
 */
public final class KellySizer {
    private static final Logger logger = LoggerFactory.getLogger(KellySizer.class);

    private final double kellyFraction;

    public KellySizer(double kellyFraction) {
        if (!(kellyFraction > 0.0 && kellyFraction <= 1.0)) {
            throw new IllegalArgumentException("kellyFraction must be within (0, 1]: " + kellyFraction);
        }
        this.kellyFraction = kellyFraction;
    }

    /**
     * Unscaled Kelly fraction; zero or negative when the edge does not favour the side.
     */
    public double rawKelly(Opportunity opportunity, double edge) {
        double odds = opportunity.payoutOdds();
        if (odds <= 0.0) {
            return 0.0;
        }
        double p = opportunity.winProbability(edge);
        double q = 1.0 - p;
        return (odds * p - q) / odds;
    }

    /**
     * USDC stake before min/max clipping. Never negative.
     */
    public double stake(Opportunity opportunity, double edge, double confidence, double balance) {
        double raw = rawKelly(opportunity, edge);
        double scaled = Math.max(0.0, raw) * kellyFraction * confidence;
        double stake = scaled * Math.max(0.0, balance);

        logger.debug("Kelly sizing {}: edge={}, price={}, raw={}, scaled={}, stake=${}",
            opportunity.marketId(), String.format("%.3f", edge),
            String.format("%.3f", opportunity.currentPrice()),
            String.format("%.4f", raw), String.format("%.4f", scaled), String.format("%.2f", stake));
        return stake;
    }

    public double kellyFraction() {
        return kellyFraction;
    }
}
