package com.polytrade.scanner;

/**
 * External market-data scanner. Implementations talk to the market API and
 * must only hand back validated {@link Opportunity} instances.
 */
@FunctionalInterface
public interface MarketScanner {
    ScanResult scan();
}
