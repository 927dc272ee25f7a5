package com.slwatchdog.ledger;

import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.model.BrokerHolding;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.oms.ExitOrderRequest;
import com.slwatchdog.oms.OrderOutcome;
import com.slwatchdog.reconciliation.ReconciliationResult;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Authoritative in-memory record of tracked positions.
 *
 * <p>Every read-decide-write sequence on a ticker runs inside
 * {@link ConcurrentHashMap#compute}, which serialises work on the same ticker while
 * different tickers proceed in parallel. Readers only ever receive copies.
 *
 * <p>The ledger is the only place that creates, mutates and removes {@link Position}s:
 * <ul>
 *   <li>{@link #reserveExit} decides and sets the pending-order gate atomically, so at most
 *       one exit order per ticker is ever in flight;</li>
 *   <li>{@link #applyOutcome} applies the executor's result and removes the position once
 *       its quantity reaches zero;</li>
 *   <li>{@link #upsertFromBroker} aligns with the broker without dropping positions whose
 *       exit is still in flight or settling.</li>
 * </ul>
 */
@Slf4j
@Component
public class PositionLedger {

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    /** ticker -> time the position left the ledger; shields it from being re-added by a lagging broker. */
    private final Map<String, Instant> recentlyClosed = new ConcurrentHashMap<>();

    private final Duration graceWindow;
    private final Clock clock;

    public PositionLedger(WatchdogProperties watchdogProperties, Clock clock) {
        this.graceWindow = watchdogProperties.getGraceWindow();
        this.clock = clock;
    }

    public Optional<Position> get(String ticker) {
        return Optional.ofNullable(copyOf(ticker));
    }

    /** Adds or replaces a position after validating it. */
    public void put(Position position) {
        position.validate();
        positions.put(position.getTicker(), position.copy());
        recentlyClosed.remove(position.getTicker());
    }

    /** Adds the position only if the ticker is not tracked yet. */
    public boolean putIfAbsent(Position position) {
        position.validate();
        boolean added = positions.putIfAbsent(position.getTicker(), position.copy()) == null;
        if (added) {
            recentlyClosed.remove(position.getTicker());
        }
        return added;
    }

    public Optional<Position> remove(String ticker) {
        Position removed = positions.remove(ticker);
        if (removed != null) {
            recentlyClosed.put(ticker, clock.instant());
        }
        return Optional.ofNullable(removed);
    }

    public boolean contains(String ticker) {
        return positions.containsKey(ticker);
    }

    public Set<String> tickers() {
        return Set.copyOf(positions.keySet());
    }

    public List<Position> snapshot() {
        List<Position> copies = new ArrayList<>();
        for (String ticker : positions.keySet()) {
            Position copy = copyOf(ticker);
            if (copy != null) {
                copies.add(copy);
            }
        }
        copies.sort(Comparator.comparing(Position::getTicker));
        return copies;
    }

    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    /**
     * Atomically runs an exit decision for one ticker and raises the pending gate if it
     * produces an order. Returns empty without calling {@code decider} when the ticker is
     * untracked or already has an order in flight.
     *
     * <p>{@code decider} runs while the ticker is locked; it may assign tranches to the
     * position it receives but must not block on I/O beyond cached lookups.
     */
    public Optional<ExitOrderRequest> reserveExit(
            String ticker, Function<Position, Optional<ExitOrderRequest>> decider) {
        ExitOrderRequest[] reserved = new ExitOrderRequest[1];
        positions.computeIfPresent(ticker, (key, position) -> {
            if (position.hasPendingOrder()) {
                log.debug("Skipping evaluation, order pending: ticker={}", key);
                return position;
            }
            Optional<ExitOrderRequest> decision = decider.apply(position);
            if (decision.isPresent()) {
                position.setPendingOrder(true);
                position.setPendingSince(clock.instant());
                reserved[0] = decision.get();
            }
            return position;
        });
        return Optional.ofNullable(reserved[0]);
    }

    /**
     * Applies an order outcome.
     *
     * <p>Successful or duplicate outcomes mark the tranche triggered and decrement the
     * quantity exactly once per tranche: a second success for an already-triggered tranche
     * only clears the pending flag. Failures clear the flag and leave everything else.
     *
     * @return true if the outcome closed the position
     */
    public boolean applyOutcome(OrderOutcome outcome) {
        String ticker = outcome.getTicker();
        Instant now = clock.instant();
        boolean[] closed = new boolean[1];
        Position after = positions.computeIfPresent(ticker, (key, position) -> {
            position.setPendingOrder(false);
            position.setPendingSince(null);
            if (!outcome.getStatus().isSuccess()) {
                log.warn(
                        "Exit failed, ticker released for re-evaluation: ticker={}, tranche={}, qty={}, attempts={}, error={}",
                        key,
                        outcome.getTrancheId(),
                        position.getQuantity(),
                        outcome.getAttempts(),
                        outcome.getErrorMessage());
                return position;
            }
            if (!position.triggerTranche(outcome.getTrancheId())) {
                log.warn(
                        "Tranche already applied, quantity unchanged: ticker={}, tranche={}, qty={}",
                        key,
                        outcome.getTrancheId(),
                        position.getQuantity());
                return position;
            }
            int remaining = Math.max(0, position.getQuantity() - outcome.getFilledQuantity());
            position.setQuantity(remaining);
            position.setLastFillAt(now);
            log.info(
                    "Exit applied: ticker={}, tranche={}, status={}, filled={}, remaining={}/{}",
                    key,
                    outcome.getTrancheId(),
                    outcome.getStatus(),
                    outcome.getFilledQuantity(),
                    remaining,
                    position.getOriginalQuantity());
            if (remaining == 0) {
                closed[0] = true;
                return null;
            }
            return position;
        });
        if (after == null && closed[0]) {
            recentlyClosed.put(ticker, now);
            log.info("Position fully exited, removed from ledger: ticker={}", ticker);
        }
        if (!closed[0] && after == null && !positions.containsKey(ticker)) {
            log.warn("Outcome for untracked ticker ignored: ticker={}, status={}", ticker, outcome.getStatus());
        }
        return closed[0];
    }

    /**
     * Aligns the ledger with the broker's view.
     *
     * <ul>
     *   <li>Broker positions not tracked yet are added, unless the ticker left the ledger
     *       within the grace window (the broker may still be reporting a just-sold lot).</li>
     *   <li>Tracked positions with a different broker quantity are updated when no order is
     *       pending; the original quantity is raised if the broker shows more shares. A
     *       broker row on the other side is reported as retained and never synced.</li>
     *   <li>Tracked positions the broker no longer reports are removed, except while an
     *       order is pending or the last fill is within the grace window.</li>
     * </ul>
     *
     * @param holdings broker positions, already filtered by the caller's exclusion policy
     */
    public ReconciliationResult upsertFromBroker(List<BrokerHolding> holdings, String defaultExchange) {
        Instant now = clock.instant();
        pruneRecentlyClosed(now);

        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(now)
                .brokerPositionCount(holdings.size())
                .localPositionCount(positions.size())
                .build();

        Set<String> brokerTickers = new HashSet<>();
        for (BrokerHolding holding : holdings) {
            String ticker = holding.getTradingSymbol();
            brokerTickers.add(ticker);

            if (!positions.containsKey(ticker)) {
                if (recentlyClosed.containsKey(ticker)) {
                    log.info("Not re-adding recently exited ticker: ticker={}, brokerQty={}", ticker, holding.getQuantity());
                    result.getRetained().add(ticker);
                    continue;
                }
                Position position = fromHolding(holding, defaultExchange, now);
                if (putIfAbsent(position)) {
                    result.getAdded().add(ticker);
                    log.info(
                            "Tracking new broker position: ticker={}, side={}, qty={}, avgPrice={}, source={}",
                            ticker,
                            position.getSide(),
                            position.getQuantity(),
                            position.getEntryPrice(),
                            position.getSource());
                }
                continue;
            }

            positions.computeIfPresent(ticker, (key, position) -> {
                if (holding.getSide() != position.getSide()) {
                    log.warn(
                            "Broker side differs from tracked side, quantity left as is: ticker={}, local={} {}, broker={} {}",
                            key,
                            position.getSide(),
                            position.getQuantity(),
                            holding.getSide(),
                            holding.getQuantity());
                    result.getRetained().add(key);
                    return position;
                }
                if (position.getQuantity() == holding.getQuantity() || position.hasPendingOrder()) {
                    return position;
                }
                if (position.getLastFillAt() != null && isWithinGrace(position.getLastFillAt(), now)) {
                    return position;
                }
                log.warn(
                        "Quantity mismatch, syncing from broker: ticker={}, local={}, broker={}",
                        key,
                        position.getQuantity(),
                        holding.getQuantity());
                position.setQuantity(holding.getQuantity());
                if (holding.getQuantity() > position.getOriginalQuantity()) {
                    position.setOriginalQuantity(holding.getQuantity());
                }
                result.getQuantityUpdated().add(key);
                return position;
            });
        }

        for (String ticker : tickers()) {
            if (brokerTickers.contains(ticker)) {
                continue;
            }
            boolean[] removed = new boolean[1];
            positions.computeIfPresent(ticker, (key, position) -> {
                if (position.hasPendingOrder()
                        || (position.getLastFillAt() != null && isWithinGrace(position.getLastFillAt(), now))) {
                    log.info(
                            "Position missing at broker but retained: ticker={}, pending={}, lastFill={}",
                            key,
                            position.hasPendingOrder(),
                            position.getLastFillAt());
                    result.getRetained().add(key);
                    return position;
                }
                removed[0] = true;
                return null;
            });
            if (removed[0]) {
                recentlyClosed.put(ticker, now);
                result.getRemoved().add(ticker);
                log.info("Position no longer at broker, removed: ticker={}", ticker);
            }
        }
        return result;
    }

    private Position copyOf(String ticker) {
        Position[] copy = new Position[1];
        positions.computeIfPresent(ticker, (key, position) -> {
            copy[0] = position.copy();
            return position;
        });
        return copy[0];
    }

    private boolean isWithinGrace(Instant at, Instant now) {
        return Duration.between(at, now).compareTo(graceWindow) < 0;
    }

    private void pruneRecentlyClosed(Instant now) {
        recentlyClosed.entrySet().removeIf(e -> !isWithinGrace(e.getValue(), now));
    }

    private static Position fromHolding(BrokerHolding holding, String defaultExchange, Instant now) {
        BigDecimal entry = entryPrice(holding);
        if (entry.signum() <= 0) {
            log.warn("No average or last price for {}, profit targets disabled", holding.getTradingSymbol());
        }
        return Position.builder()
                .ticker(holding.getTradingSymbol())
                .exchange(holding.getExchange() != null ? holding.getExchange() : defaultExchange)
                .product(holding.getProduct())
                .instrumentToken(holding.getInstrumentToken())
                .side(holding.getSide())
                .quantity(holding.getQuantity())
                .originalQuantity(holding.getQuantity())
                .entryPrice(entry)
                .investmentAmount(entry.multiply(BigDecimal.valueOf(holding.getQuantity())))
                .source(holding.getSource())
                .openedAt(now)
                .build();
    }

    /** Broker average price, else the broker's last price, else zero (entry unknown). */
    private static BigDecimal entryPrice(BrokerHolding holding) {
        if (holding.getAveragePrice() != null && holding.getAveragePrice().signum() > 0) {
            return holding.getAveragePrice();
        }
        if (holding.getLastPrice() != null && holding.getLastPrice().signum() > 0) {
            return holding.getLastPrice();
        }
        return BigDecimal.ZERO;
    }
}
