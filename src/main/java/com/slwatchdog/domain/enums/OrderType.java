package com.slwatchdog.domain.enums;

/** Exit orders are either priced (LIMIT, stop-loss tranche) or unpriced (MARKET, profit targets). */
public enum OrderType {
    MARKET,
    LIMIT
}
