package com.slwatchdog.exception;

import org.springframework.boot.ExitCodeGenerator;

/** Access token missing, expired or rejected. Fatal at startup. */
public class BrokerAuthException extends BrokerException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 3;

    public BrokerAuthException(String message) {
        super(ErrorCode.BROKER_AUTH, message, null);
    }

    public BrokerAuthException(String message, Throwable cause) {
        super(ErrorCode.BROKER_AUTH, message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
