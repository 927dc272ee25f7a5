package com.slwatchdog.reconciliation;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.model.BrokerHolding;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.event.PositionClosedEvent;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.policy.TickerExclusionPolicy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Keeps the {@link PositionLedger} in line with the broker's positions and holdings.
 *
 * <p>Runs once at startup and then on the control loop's reconcile interval. Each run:
 * <ol>
 *   <li>fetches merged positions + holdings from the broker;</li>
 *   <li>drops excluded tickers and, when a ticker filter is set, tickers outside it;</li>
 *   <li>hands the rest to {@link PositionLedger#upsertFromBroker}, which owns the
 *       grace-window rules;</li>
 *   <li>publishes a {@link PositionClosedEvent} for every ticker removed.</li>
 * </ol>
 * Broker failures propagate to the caller: fatal at startup, logged by the control loop
 * afterwards.
 */
@Service
public class PositionReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciliationService.class);

    public static final String TRIGGER_STARTUP = "STARTUP";
    public static final String TRIGGER_SCHEDULED = "SCHEDULED";

    private final BrokerGateway brokerGateway;
    private final PositionLedger positionLedger;
    private final TickerExclusionPolicy tickerExclusionPolicy;
    private final WatchdogProperties watchdogProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public PositionReconciliationService(
            BrokerGateway brokerGateway,
            PositionLedger positionLedger,
            TickerExclusionPolicy tickerExclusionPolicy,
            WatchdogProperties watchdogProperties,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.positionLedger = positionLedger;
        this.tickerExclusionPolicy = tickerExclusionPolicy;
        this.watchdogProperties = watchdogProperties;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public ReconciliationResult reconcile(String trigger) {
        long startTime = clock.millis();
        log.debug("Position reconciliation started: trigger={}", trigger);

        List<BrokerHolding> brokerHoldings = brokerGateway.getOpenPositions();

        Set<String> allowed = allowedTickers();
        List<BrokerHolding> tracked = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (BrokerHolding holding : brokerHoldings) {
            String ticker = holding.getTradingSymbol();
            if (tickerExclusionPolicy.isExcluded(ticker)) {
                excluded.add(ticker);
                continue;
            }
            if (!allowed.isEmpty() && !allowed.contains(ticker.toUpperCase(Locale.ROOT))) {
                continue;
            }
            tracked.add(holding);
        }

        Map<String, String> exchangeByTicker = new HashMap<>();
        for (Position position : positionLedger.snapshot()) {
            exchangeByTicker.put(position.getTicker(), position.getExchange());
        }

        ReconciliationResult result = positionLedger.upsertFromBroker(tracked, watchdogProperties.getDefaultExchange());
        result.setTrigger(trigger);
        result.setExcluded(excluded);
        result.setDurationMs(clock.millis() - startTime);

        for (String ticker : result.getRemoved()) {
            applicationEventPublisher.publishEvent(new PositionClosedEvent(
                    this, ticker, exchangeByTicker.get(ticker), PositionClosedEvent.CloseCause.GONE_AT_BROKER));
        }

        if (result.hasChanges() || TRIGGER_STARTUP.equals(trigger)) {
            log.info(
                    "Reconciliation completed: trigger={}, broker={}, local={}, added={}, removed={}, retained={}, qtyUpdated={}, excluded={}, durationMs={}",
                    trigger,
                    result.getBrokerPositionCount(),
                    positionLedger.size(),
                    result.getAdded(),
                    result.getRemoved(),
                    result.getRetained(),
                    result.getQuantityUpdated(),
                    excluded,
                    result.getDurationMs());
        } else {
            log.debug("Reconciliation completed, no changes: trigger={}, positions={}", trigger, positionLedger.size());
        }
        return result;
    }

    private Set<String> allowedTickers() {
        return watchdogProperties.getTickers().stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
