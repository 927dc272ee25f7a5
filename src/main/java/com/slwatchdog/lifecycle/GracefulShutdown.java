package com.slwatchdog.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Cancels the {@link ShutdownSignal} when the context closes (SIGTERM, Ctrl+C), before the
 * price feed and order executor are stopped and joined.
 *
 * <p>Open positions are left as they are: a shutdown never places exit orders.
 */
@Component
public class GracefulShutdown implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdown.class);

    private final ShutdownSignal shutdownSignal;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdown(ShutdownSignal shutdownSignal) {
        this.shutdownSignal = shutdownSignal;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (!shutdownSignal.isCancelled()) {
                log.info("Shutdown requested, signalling watchdog loops");
            }
            shutdownSignal.cancel();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // higher phase stops first
        return Integer.MAX_VALUE - 1;
    }
}
