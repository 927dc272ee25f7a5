package com.slwatchdog.feed;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.domain.model.PriceObservation;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.lifecycle.ShutdownSignal;
import com.slwatchdog.monitor.PositionMonitor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Polling loop on thread {@code price-feed}: every poll interval, fetches last traded
 * prices for all tracked tickers in batches and hands each one to the
 * {@link PositionMonitor}.
 *
 * <p>A failed batch or a failing ticker is logged and skipped; the loop only ends when
 * the {@link ShutdownSignal} is cancelled. The interval is read on every cycle, so a
 * {@code --poll-interval} override applied before start takes effect.
 */
@Component
public class PriceFeed implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PriceFeed.class);

    private final BrokerGateway brokerGateway;
    private final PositionLedger positionLedger;
    private final PositionMonitor positionMonitor;
    private final ShutdownSignal shutdownSignal;
    private final WatchdogProperties watchdogProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread feedThread;

    public PriceFeed(
            BrokerGateway brokerGateway,
            PositionLedger positionLedger,
            PositionMonitor positionMonitor,
            ShutdownSignal shutdownSignal,
            WatchdogProperties watchdogProperties,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.positionLedger = positionLedger;
        this.positionMonitor = positionMonitor;
        this.shutdownSignal = shutdownSignal;
        this.watchdogProperties = watchdogProperties;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            feedThread = new Thread(this::pollLoop, "price-feed");
            feedThread.setDaemon(true);
            feedThread.start();
            log.info(
                    "PriceFeed started: interval={}s, batchSize={}",
                    watchdogProperties.getPollInterval().toSeconds(),
                    watchdogProperties.getQuoteBatchSize());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = feedThread;
            if (thread != null) {
                try {
                    thread.join(watchdogProperties.getShutdownTimeout().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                if (thread.isAlive()) {
                    log.warn("PriceFeed did not stop in time, interrupting");
                    thread.interrupt();
                }
            }
            log.info("PriceFeed stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return false;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    private void pollLoop() {
        while (!shutdownSignal.isCancelled()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Price poll cycle failed, continuing", e);
            }
            Duration interval = watchdogProperties.getPollInterval();
            if (!shutdownSignal.sleep(interval)) {
                break;
            }
        }
        log.info("PriceFeed loop exited");
    }

    /**
     * Runs one polling cycle over the current ledger.
     *
     * @return number of observations delivered
     */
    public int pollOnce() {
        List<Position> positions = positionLedger.snapshot();
        if (positions.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (List<Position> batch : partition(positions, Math.max(1, watchdogProperties.getQuoteBatchSize()))) {
            if (shutdownSignal.isCancelled()) {
                break;
            }
            delivered += pollBatch(batch);
        }
        return delivered;
    }

    private int pollBatch(List<Position> batch) {
        List<String> keys = new ArrayList<>(batch.size());
        for (Position position : batch) {
            keys.add(position.exchangeSymbol());
        }
        Map<String, BigDecimal> prices;
        try {
            prices = brokerGateway.getLastPrices(keys);
        } catch (RuntimeException e) {
            log.warn("Quote batch failed, skipping this cycle for {} tickers: {}", keys.size(), e.getMessage());
            return 0;
        }

        Instant observedAt = clock.instant();
        int delivered = 0;
        for (Position position : batch) {
            BigDecimal price = prices.get(position.exchangeSymbol());
            if (price == null || price.signum() <= 0) {
                log.debug("No usable quote: ticker={}, price={}", position.getTicker(), price);
                continue;
            }
            try {
                positionMonitor.onObservation(new PriceObservation(position.getTicker(), price, observedAt));
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Evaluation failed, ticker skipped this cycle: ticker={}, price={}", position.getTicker(), price, e);
            }
        }
        return delivered;
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return batches;
    }
}
