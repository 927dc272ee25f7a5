package com.slwatchdog.domain.enums;

/** Where a tracked position was first discovered. */
public enum PositionSource {
    BROKER_POSITION,
    BROKER_HOLDING,
    ORDERS_FILE
}
