package com.slwatchdog.oms;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.enums.OrderOutcomeStatus;
import com.slwatchdog.event.PositionClosedEvent;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.lifecycle.ShutdownSignal;
import com.slwatchdog.retry.RetryPolicy;
import com.slwatchdog.retry.RetryResult;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer of the {@link OrderQueue}: places exit orders one at a time through
 * the {@link BrokerGateway} and applies each {@link OrderOutcome} to the ledger.
 *
 * <p>Retry and backoff live in {@link RetryPolicy}. Backoff waits on the
 * {@link ShutdownSignal}, so they block only this thread and end early on shutdown.
 * Duplicate-order responses count as success with the requested quantity as the fill.
 * A request that exhausts its attempts clears the ticker's pending gate so the exit
 * engine can decide again on the next price.
 *
 * <p>Not auto-started: the runner starts it once the ledger is populated. On shutdown,
 * requests still queued are not sent; they are released as FAILED so their pending gates
 * clear and the audit trail shows they were abandoned.
 */
@Component
public class OrderExecutor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    private static final Duration IDLE_WAIT = Duration.ofMillis(500);

    private final OrderQueue orderQueue;
    private final BrokerGateway brokerGateway;
    private final PositionLedger positionLedger;
    private final OrderAuditService orderAuditService;
    private final ShutdownSignal shutdownSignal;
    private final ApplicationEventPublisher eventPublisher;
    private final RetryPolicy retryPolicy;
    private final Duration shutdownTimeout;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    @Autowired
    public OrderExecutor(
            OrderQueue orderQueue,
            BrokerGateway brokerGateway,
            PositionLedger positionLedger,
            OrderAuditService orderAuditService,
            ShutdownSignal shutdownSignal,
            ApplicationEventPublisher eventPublisher,
            WatchdogProperties watchdogProperties,
            Clock clock) {
        this(
                orderQueue,
                brokerGateway,
                positionLedger,
                orderAuditService,
                shutdownSignal,
                eventPublisher,
                retryPolicyFrom(watchdogProperties.getRetry(), shutdownSignal),
                watchdogProperties.getShutdownTimeout(),
                clock);
    }

    public OrderExecutor(
            OrderQueue orderQueue,
            BrokerGateway brokerGateway,
            PositionLedger positionLedger,
            OrderAuditService orderAuditService,
            ShutdownSignal shutdownSignal,
            ApplicationEventPublisher eventPublisher,
            RetryPolicy retryPolicy,
            Duration shutdownTimeout,
            Clock clock) {
        this.orderQueue = orderQueue;
        this.brokerGateway = brokerGateway;
        this.positionLedger = positionLedger;
        this.orderAuditService = orderAuditService;
        this.shutdownSignal = shutdownSignal;
        this.eventPublisher = eventPublisher;
        this.retryPolicy = retryPolicy;
        this.shutdownTimeout = shutdownTimeout;
        this.clock = clock;
    }

    private static RetryPolicy retryPolicyFrom(WatchdogProperties.RetrySettings settings, ShutdownSignal signal) {
        return new RetryPolicy(
                settings.getMaxAttempts(),
                settings.getMultiplier(),
                settings.getRateLimitedBaseDelay(),
                settings.getTransientBaseDelay(),
                signal::sleep);
    }

    /** Audits and enqueues a request whose ticker already holds the pending gate. */
    public void submit(ExitOrderRequest request) {
        orderAuditService.recordSubmission(request);
        orderQueue.enqueue(request);
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "order-executor");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("OrderExecutor started: maxAttempts={}", retryPolicy.getMaxAttempts());
        }
    }

    /**
     * Waits up to the shutdown timeout for the consumer to finish its in-flight order,
     * then interrupts it. The caller cancels the {@link ShutdownSignal} first.
     */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = consumerThread;
            if (thread != null && !awaitTermination(thread, shutdownTimeout)) {
                log.warn("OrderExecutor did not stop within {}s, interrupting", shutdownTimeout.toSeconds());
                thread.interrupt();
            }
            log.info("OrderExecutor stopped");
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

    private void processLoop() {
        while (!shutdownSignal.isCancelled()) {
            try {
                ExitOrderRequest request = orderQueue.poll(IDLE_WAIT);
                if (request != null) {
                    process(request);
                }
            } catch (InterruptedException e) {
                log.info("OrderExecutor interrupted, leaving processing loop");
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Unexpected error in order executor loop, continuing", e);
            }
        }
        abandonRemaining();
    }

    /** Executes one request and applies its outcome. Returns the outcome for callers and tests. */
    public OrderOutcome process(ExitOrderRequest request) {
        OrderOutcome outcome = execute(request);
        complete(outcome);
        return outcome;
    }

    /** Places the order with retries; does not touch the ledger. */
    public OrderOutcome execute(ExitOrderRequest request) {
        String operation = "placeOrder ticker=" + request.getTicker() + " tranche=" + request.getTrancheId();
        RetryResult<String> result = retryPolicy.execute(operation, () -> brokerGateway.placeOrder(request));

        OrderOutcome.OrderOutcomeBuilder outcome =
                OrderOutcome.builder().request(request).attempts(result.getAttempts()).completedAt(clock.instant());
        if (result.isSuccess()) {
            return outcome.status(OrderOutcomeStatus.FILLED)
                    .brokerOrderId(result.getValue())
                    .filledQuantity(request.getQuantity())
                    .build();
        }
        if (result.isDuplicate()) {
            return outcome.status(OrderOutcomeStatus.DUPLICATE)
                    .filledQuantity(request.getQuantity())
                    .errorMessage(result.getLastError().getMessage())
                    .build();
        }
        return outcome.status(OrderOutcomeStatus.FAILED)
                .filledQuantity(0)
                .errorMessage(result.getLastErrorClass() + ": " + result.getLastError().getMessage())
                .build();
    }

    private void complete(OrderOutcome outcome) {
        orderAuditService.recordOutcome(outcome);
        boolean closed = positionLedger.applyOutcome(outcome);
        if (closed) {
            eventPublisher.publishEvent(new PositionClosedEvent(
                    this,
                    outcome.getTicker(),
                    outcome.getRequest().getExchange(),
                    PositionClosedEvent.CloseCause.EXIT_FILLED));
        }
    }

    private void abandonRemaining() {
        int abandoned = 0;
        ExitOrderRequest remaining;
        while ((remaining = orderQueue.poll()) != null) {
            complete(OrderOutcome.builder()
                    .request(remaining)
                    .status(OrderOutcomeStatus.FAILED)
                    .filledQuantity(0)
                    .attempts(0)
                    .errorMessage("abandoned at shutdown before submission")
                    .completedAt(clock.instant())
                    .build());
            abandoned++;
        }
        if (abandoned > 0) {
            log.warn("Released {} queued exit orders without submitting them during shutdown", abandoned);
        }
    }

    private static boolean awaitTermination(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }
}
