package com.slwatchdog.unit.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.slwatchdog.exception.BrokerAuthException;
import com.slwatchdog.exception.BrokerException;
import com.slwatchdog.exception.DuplicateOrderException;
import com.slwatchdog.exception.RateLimitedException;
import com.slwatchdog.retry.ErrorClass;
import com.slwatchdog.retry.RetryPolicy;
import com.slwatchdog.retry.RetryResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for RetryPolicy: backoff schedule, attempt bounds, and per-class handling. */
class RetryPolicyTest {

    private final List<Duration> pauses = new ArrayList<>();
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new RetryPolicy(5, 1.5, Duration.ofSeconds(2), Duration.ofSeconds(1), delay -> {
            pauses.add(delay);
            return true;
        });
    }

    @Test
    @DisplayName("Backoff grows geometrically from each class's base delay")
    void backoffSchedule() {
        assertThat(policy.backoff(ErrorClass.RATE_LIMITED, 1)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.backoff(ErrorClass.RATE_LIMITED, 2)).isEqualTo(Duration.ofMillis(3000));
        assertThat(policy.backoff(ErrorClass.RATE_LIMITED, 3)).isEqualTo(Duration.ofMillis(4500));
        assertThat(policy.backoff(ErrorClass.TRANSIENT, 1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoff(ErrorClass.TRANSIENT, 2)).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("First-try success makes one attempt and never pauses")
    void immediateSuccess() {
        RetryResult<String> result = policy.execute("op", () -> "ok");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("ok");
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    @DisplayName("Transient failures are retried until success")
    void transientThenSuccess() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = policy.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new BrokerException("connection reset");
            }
            return "id-3";
        });

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(pauses).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("Rate limits exhaust the attempt budget with rate-limit delays")
    void rateLimitedExhausted() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = policy.execute("op", () -> {
            calls.incrementAndGet();
            throw new RateLimitedException("Too many requests");
        });

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(5);
        assertThat(result.getLastErrorClass()).isEqualTo(ErrorClass.RATE_LIMITED);
        assertThat(calls).hasValue(5);
        assertThat(pauses).hasSize(4).first().isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    @DisplayName("A duplicate ends the loop as a duplicate result")
    void duplicateEndsLoop() {
        RetryResult<String> result = policy.execute("op", () -> {
            throw new DuplicateOrderException("Duplicate order tag");
        });

        assertThat(result.isDuplicate()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getLastError()).isInstanceOf(DuplicateOrderException.class);
    }

    @Test
    @DisplayName("Fatal errors are not retried")
    void fatalNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = policy.execute("op", () -> {
            calls.incrementAndGet();
            throw new BrokerAuthException("TokenException");
        });

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getLastErrorClass()).isEqualTo(ErrorClass.FATAL);
        assertThat(calls).hasValue(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    @DisplayName("An interrupted pause aborts remaining attempts")
    void pauseAbort() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy aborting = new RetryPolicy(5, 1.5, Duration.ofSeconds(2), Duration.ofSeconds(1), delay -> false);

        RetryResult<String> result = aborting.execute("op", () -> {
            calls.incrementAndGet();
            throw new BrokerException("timeout");
        });

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("At least one attempt is required")
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, 1.5, Duration.ofSeconds(1), Duration.ofSeconds(1), d -> true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
