package com.polytrade.risk;

import java.time.LocalDate;

/**
 * Reporting view of the latched halts.
 */
public record RiskStatus(
    boolean manuallyHalted,
    String haltReason,
    LocalDate dailyHaltDay,
    boolean weeklyHalted,
    boolean drawdownHalted
) {
    public boolean isHalted() {
        return manuallyHalted || dailyHaltDay != null || weeklyHalted || drawdownHalted;
    }
}
