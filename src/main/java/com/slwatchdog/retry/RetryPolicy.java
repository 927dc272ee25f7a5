package com.slwatchdog.retry;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry with exponential backoff, driven by {@link ErrorClassifier}.
 *
 * <p>Rate-limited and transient failures are retried on separate schedules
 * ({@code base * multiplier^(attempt-1)}); duplicates end the loop as a success; fatal
 * errors end it immediately. Waiting is delegated to a {@code pause} function that
 * returns false when the wait was cut short, which aborts the remaining attempts.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final IntervalFunction rateLimitedBackoff;
    private final IntervalFunction transientBackoff;
    private final Function<Duration, Boolean> pause;

    public RetryPolicy(
            int maxAttempts,
            double multiplier,
            Duration rateLimitedBaseDelay,
            Duration transientBaseDelay,
            Function<Duration, Boolean> pause) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.rateLimitedBackoff = IntervalFunction.ofExponentialBackoff(rateLimitedBaseDelay, multiplier);
        this.transientBackoff = IntervalFunction.ofExponentialBackoff(transientBaseDelay, multiplier);
        this.pause = pause;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Delay before the attempt after {@code failedAttempt} (1-based). */
    public Duration backoff(ErrorClass errorClass, int failedAttempt) {
        IntervalFunction schedule = errorClass == ErrorClass.RATE_LIMITED ? rateLimitedBackoff : transientBackoff;
        return Duration.ofMillis(schedule.apply(failedAttempt));
    }

    public <T> RetryResult<T> execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return RetryResult.success(call.get(), attempt);
            } catch (RuntimeException e) {
                ErrorClass errorClass = ErrorClassifier.classify(e);
                switch (errorClass) {
                    case DUPLICATE:
                        log.warn("{} reported as duplicate on attempt {}: {}", operation, attempt, e.getMessage());
                        return RetryResult.duplicate(attempt, e);
                    case FATAL:
                        log.error("{} failed with non-retryable error on attempt {}: {}", operation, attempt, e.getMessage());
                        return RetryResult.failed(attempt, e, errorClass);
                    default:
                        break;
                }
                if (attempt >= maxAttempts) {
                    log.error(
                            "{} failed after {} attempts ({}): {}", operation, attempt, errorClass, e.getMessage());
                    return RetryResult.failed(attempt, e, errorClass);
                }
                Duration delay = backoff(errorClass, attempt);
                log.warn(
                        "{} failed ({}), retry {}/{} after {}ms: {}",
                        operation,
                        errorClass,
                        attempt,
                        maxAttempts - 1,
                        delay.toMillis(),
                        e.getMessage());
                if (!Boolean.TRUE.equals(pause.apply(delay))) {
                    log.warn("{} retry aborted by shutdown after {} attempts", operation, attempt);
                    return RetryResult.failed(attempt, e, errorClass);
                }
            }
        }
    }
}
