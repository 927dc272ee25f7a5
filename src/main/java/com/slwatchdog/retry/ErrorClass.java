package com.slwatchdog.retry;

/** How a failed broker call should be handled by {@link RetryPolicy}. */
public enum ErrorClass {
    /** Broker throttled the call; retry on the rate-limit backoff schedule. */
    RATE_LIMITED,
    /** Network hiccup, circuit open, generic broker error; retry on the transient schedule. */
    TRANSIENT,
    /** The broker already has this order; treat as success. */
    DUPLICATE,
    /** Retrying cannot help (auth, bad input). */
    FATAL
}
