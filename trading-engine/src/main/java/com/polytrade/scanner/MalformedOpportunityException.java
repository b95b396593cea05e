package com.polytrade.scanner;

/**
 * Raised at the scanner boundary when a market payload cannot be turned into an {@link Opportunity}.
 */
public class MalformedOpportunityException extends RuntimeException {
    public MalformedOpportunityException(String message) {
        super(message);
    }

    public MalformedOpportunityException(String message, Throwable cause) {
        super(message, cause);
    }
}
