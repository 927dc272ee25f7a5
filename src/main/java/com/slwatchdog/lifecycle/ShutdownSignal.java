package com.slwatchdog.lifecycle;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Process-wide cancellation token shared by the watchdog loops.
 *
 * <p>Loops wait on the signal instead of sleeping, so a cancel wakes them immediately
 * at their next iteration boundary (including an order retry backoff in progress).
 */
@Component
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits for the given duration unless cancelled first.
     *
     * @return true if the full duration elapsed, false if cancelled or interrupted
     */
    public boolean sleep(Duration duration) {
        try {
            return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
