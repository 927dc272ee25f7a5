package com.slwatchdog.domain.enums;

/**
 * Terminal result of one exit order as seen by the order executor.
 *
 * <p>FILLED and DUPLICATE both reduce the position. FAILED leaves quantity untouched
 * and releases the ticker for re-evaluation on the next price cycle.
 */
public enum OrderOutcomeStatus {
    FILLED,
    DUPLICATE,
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
