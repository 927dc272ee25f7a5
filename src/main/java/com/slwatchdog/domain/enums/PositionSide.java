package com.slwatchdog.domain.enums;

/**
 * Direction of a tracked position. LONG positions are protected below price,
 * SHORT positions above it.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /** Order side that reduces this position: LONG exits with SELL, SHORT with BUY. */
    public OrderSide exitSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
