package com.polytrade.engine;

/**
 * What one scan cycle did.
 */
public record CycleReport(
    int exitsClosed,
    int marketsScanned,
    int opportunitiesConsidered,
    int executed,
    int failed,
    int rejected,
    boolean snapshotPersisted
) {
    public String getSummary() {
        return String.format("exits=%d scanned=%d considered=%d executed=%d failed=%d rejected=%d snapshot=%s",
            exitsClosed, marketsScanned, opportunitiesConsidered, executed, failed, rejected,
            snapshotPersisted ? "ok" : "FAILED");
    }
}
