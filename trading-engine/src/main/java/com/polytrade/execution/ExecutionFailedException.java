package com.polytrade.execution;

/**
 * Raised inside the executor circuit breaker when a placement failed, timed out or threw,
 * so the breaker counts it as a failure.
 */
public class ExecutionFailedException extends RuntimeException {
    public ExecutionFailedException(String message) {
        super(message);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
