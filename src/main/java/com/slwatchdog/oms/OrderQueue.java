package com.slwatchdog.oms;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO hand-off between the producers (price feed, control loop) and the single
 * {@link OrderExecutor} consumer. This is the only cross-thread queue in the watchdog.
 *
 * <p>Unbounded: the pending-order gate in the ledger allows at most one queued request
 * per ticker, so the queue never holds more entries than there are tracked positions.
 */
@Component
public class OrderQueue {

    private static final Logger log = LoggerFactory.getLogger(OrderQueue.class);

    private final LinkedBlockingQueue<ExitOrderRequest> queue = new LinkedBlockingQueue<>();

    public void enqueue(ExitOrderRequest request) {
        queue.add(request);
        log.debug("Exit order enqueued: ticker={}, tranche={}, queueSize={}", request.getTicker(), request.getTrancheId(), queue.size());
    }

    /**
     * Waits up to {@code timeout} for the next request.
     *
     * @return the oldest request, or null if none arrived in time
     */
    public ExitOrderRequest poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Non-blocking: the oldest request, or null if the queue is empty. */
    public ExitOrderRequest poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
