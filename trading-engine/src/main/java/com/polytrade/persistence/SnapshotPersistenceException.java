package com.polytrade.persistence;

public class SnapshotPersistenceException extends RuntimeException {
    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
