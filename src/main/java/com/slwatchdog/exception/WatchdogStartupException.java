package com.slwatchdog.exception;

import org.springframework.boot.ExitCodeGenerator;

/** Startup cannot continue (nothing to track, unreadable input). Maps to a non-zero exit code. */
public class WatchdogStartupException extends BaseException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public WatchdogStartupException(String message) {
        super(ErrorCode.STARTUP_FAILED, message);
    }

    public WatchdogStartupException(String message, Throwable cause) {
        super(ErrorCode.STARTUP_FAILED, message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
