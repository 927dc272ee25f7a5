package com.slwatchdog.policy;

/**
 * Decides whether a ticker is kept out of tracking and trading entirely. Consulted by
 * reconciliation before positions enter the ledger and by the monitor before each
 * evaluation, so a ticker excluded at runtime stops trading immediately.
 */
public interface TickerExclusionPolicy {

    boolean isExcluded(String ticker);
}
