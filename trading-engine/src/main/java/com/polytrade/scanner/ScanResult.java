package com.polytrade.scanner;

import java.util.List;

/**
 * Output of one scanner pass: how many markets were examined and the opportunities found.
 */
public record ScanResult(int marketsScanned, List<Opportunity> opportunities) {
    public ScanResult {
        opportunities = List.copyOf(opportunities);
    }

    public static ScanResult empty() {
        return new ScanResult(0, List.of());
    }
}
