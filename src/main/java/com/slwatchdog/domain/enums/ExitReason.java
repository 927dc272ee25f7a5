package com.slwatchdog.domain.enums;

public enum ExitReason {
    STOP_LOSS,
    PROFIT_TARGET
}
