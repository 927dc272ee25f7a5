package com.slwatchdog.monitor;

import com.slwatchdog.domain.model.Position;
import com.slwatchdog.domain.model.PriceObservation;
import com.slwatchdog.domain.model.StopLevel;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.exit.ExitDecisionEngine;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.oms.ExitOrderRequest;
import com.slwatchdog.oms.OrderExecutor;
import com.slwatchdog.policy.TickerExclusionPolicy;
import com.slwatchdog.stop.TrailingStopTracker;
import com.slwatchdog.volatility.VolatilityService;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-price pipeline: volatility reading, trailing stop, exit decision, enqueue.
 *
 * <p>The decision and the pending-gate update run inside
 * {@link PositionLedger#reserveExit}, so two observations for the same ticker can never
 * both produce an order.
 */
@Service
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    private final PositionLedger positionLedger;
    private final VolatilityService volatilityService;
    private final TrailingStopTracker trailingStopTracker;
    private final ExitDecisionEngine exitDecisionEngine;
    private final OrderExecutor orderExecutor;
    private final TickerExclusionPolicy tickerExclusionPolicy;

    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    public PositionMonitor(
            PositionLedger positionLedger,
            VolatilityService volatilityService,
            TrailingStopTracker trailingStopTracker,
            ExitDecisionEngine exitDecisionEngine,
            OrderExecutor orderExecutor,
            TickerExclusionPolicy tickerExclusionPolicy) {
        this.positionLedger = positionLedger;
        this.volatilityService = volatilityService;
        this.trailingStopTracker = trailingStopTracker;
        this.exitDecisionEngine = exitDecisionEngine;
        this.orderExecutor = orderExecutor;
        this.tickerExclusionPolicy = tickerExclusionPolicy;
    }

    /**
     * Handles one observation.
     *
     * @return the exit request enqueued for it, if any
     */
    public Optional<ExitOrderRequest> onObservation(PriceObservation observation) {
        String ticker = observation.getTicker();
        BigDecimal price = observation.getPrice();
        if (tickerExclusionPolicy.isExcluded(ticker)) {
            return Optional.empty();
        }
        Optional<Position> tracked = positionLedger.get(ticker);
        if (tracked.isEmpty()) {
            return Optional.empty();
        }
        Position position = tracked.get();
        lastPrices.put(ticker, price);

        Optional<VolatilityInfo> volatility = volatilityService.refreshIfDue(position);
        if (volatility.isEmpty()) {
            log.debug("No volatility reading yet, skipping: ticker={}, price={}", ticker, price);
            return Optional.empty();
        }
        VolatilityInfo info = volatility.get();
        StopLevel stop = trailingStopTracker.onPrice(ticker, position.getSide(), price, info);
        log.debug(
                "Tick: ticker={}, price={}, stop={}, extreme={}, qty={}, pending={}",
                ticker,
                price,
                stop.getStopPrice(),
                stop.getExtreme(),
                position.getQuantity(),
                position.hasPendingOrder());

        Optional<ExitOrderRequest> request =
                positionLedger.reserveExit(ticker, p -> exitDecisionEngine.evaluate(p, price, stop, info));
        request.ifPresent(r -> {
            log.info(
                    "Exit decided: ticker={}, reason={}, tranche={}, price={}, stop={}, atr={}, qty={}, limit={}",
                    ticker,
                    r.getReason(),
                    r.getTrancheId(),
                    price,
                    stop.getStopPrice(),
                    info.getAtrValue(),
                    r.getQuantity(),
                    r.getLimitPrice());
            orderExecutor.submit(r);
        });
        return request;
    }

    public Optional<BigDecimal> lastPrice(String ticker) {
        return Optional.ofNullable(lastPrices.get(ticker));
    }

    public void forget(String ticker) {
        lastPrices.remove(ticker);
    }
}
