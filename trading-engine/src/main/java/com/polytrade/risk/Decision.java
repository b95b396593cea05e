package com.polytrade.risk;

/**
 * Outcome of a risk evaluation. A rejection is an expected control outcome, not an error.
 *
 * @param approved whether the trade may proceed
 * @param size     approved USDC stake, 0 when rejected
 * @param reason   rejection reason, null when approved
 * @param detail   human readable explanation for logs
 */
public record Decision(boolean approved, double size, RejectReason reason, String detail) {

    public static Decision approve(double size) {
        return new Decision(true, size, null, "OK");
    }

    public static Decision reject(RejectReason reason, String detail) {
        return new Decision(false, 0.0, reason, detail);
    }

    public boolean isRejected() {
        return !approved;
    }

    @Override
    public String toString() {
        return approved
            ? String.format("APPROVED $%.2f", size)
            : String.format("REJECTED %s: %s", reason, detail);
    }
}
