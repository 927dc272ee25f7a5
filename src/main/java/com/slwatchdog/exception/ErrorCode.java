package com.slwatchdog.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INSUFFICIENT_DATA("INSUFFICIENT_DATA", true),
    RATE_LIMITED("RATE_LIMITED", true),
    DUPLICATE_ORDER("DUPLICATE_ORDER", true),
    INSTRUMENT_NOT_FOUND("INSTRUMENT_NOT_FOUND", true),
    BROKER_ERROR("BROKER_ERROR", true),
    BROKER_AUTH("BROKER_AUTH", false),
    STARTUP_FAILED("STARTUP_FAILED", false);

    private final String code;
    private final boolean recoverable;
}
