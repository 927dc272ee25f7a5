package com.slwatchdog.retry;

import lombok.Value;

/**
 * Result of {@link RetryPolicy#execute}. Exactly one of: a value (success), a duplicate
 * (the call already took effect), or a failure with the last error.
 */
@Value
public class RetryResult<T> {

    public enum Status {
        SUCCESS,
        DUPLICATE,
        FAILED
    }

    Status status;
    T value;
    int attempts;
    RuntimeException lastError;
    ErrorClass lastErrorClass;

    static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(Status.SUCCESS, value, attempts, null, null);
    }

    static <T> RetryResult<T> duplicate(int attempts, RuntimeException error) {
        return new RetryResult<>(Status.DUPLICATE, null, attempts, error, ErrorClass.DUPLICATE);
    }

    static <T> RetryResult<T> failed(int attempts, RuntimeException error, ErrorClass errorClass) {
        return new RetryResult<>(Status.FAILED, null, attempts, error, errorClass);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
