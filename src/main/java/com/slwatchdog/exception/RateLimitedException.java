package com.slwatchdog.exception;

/** Broker rejected the call with HTTP 429 / "Too many requests". Retried with backoff. */
public class RateLimitedException extends BrokerException {

    public RateLimitedException(String message) {
        super(ErrorCode.RATE_LIMITED, message, null);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(ErrorCode.RATE_LIMITED, message, cause);
    }
}
