package com.slwatchdog.exception;

/**
 * Broker reports that an identical order was already placed or executed.
 * The order executor treats this as a successful placement.
 */
public class DuplicateOrderException extends BrokerException {

    public DuplicateOrderException(String message) {
        super(ErrorCode.DUPLICATE_ORDER, message, null);
    }

    public DuplicateOrderException(String message, Throwable cause) {
        super(ErrorCode.DUPLICATE_ORDER, message, cause);
    }
}
