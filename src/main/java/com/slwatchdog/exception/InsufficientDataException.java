package com.slwatchdog.exception;

import java.util.Map;

/** Not enough daily bars to compute volatility. The previous volatility reading stays in use. */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String ticker, int available, int required) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                "Insufficient daily bars for " + ticker + ": have " + available + ", need " + required,
                Map.of("ticker", ticker, "available", available, "required", required));
    }
}
