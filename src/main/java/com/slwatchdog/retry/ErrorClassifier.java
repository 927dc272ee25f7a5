package com.slwatchdog.retry;

import com.slwatchdog.exception.BaseException;
import com.slwatchdog.exception.BrokerAuthException;
import com.slwatchdog.exception.DuplicateOrderException;
import com.slwatchdog.exception.InstrumentNotFoundException;
import com.slwatchdog.exception.RateLimitedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

/** Maps exceptions to an {@link ErrorClass} by type. No message parsing happens here. */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ErrorClass classify(Throwable error) {
        if (error instanceof DuplicateOrderException) {
            return ErrorClass.DUPLICATE;
        }
        if (error instanceof RateLimitedException || error instanceof RequestNotPermitted) {
            return ErrorClass.RATE_LIMITED;
        }
        if (error instanceof BrokerAuthException
                || error instanceof InstrumentNotFoundException
                || error instanceof IllegalArgumentException) {
            return ErrorClass.FATAL;
        }
        if (error instanceof CallNotPermittedException) {
            return ErrorClass.TRANSIENT;
        }
        if (error instanceof BaseException baseException && !baseException.isRecoverable()) {
            return ErrorClass.FATAL;
        }
        return ErrorClass.TRANSIENT;
    }
}
