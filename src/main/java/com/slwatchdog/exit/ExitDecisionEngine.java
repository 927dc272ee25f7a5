package com.slwatchdog.exit;

import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.enums.ExitReason;
import com.slwatchdog.domain.enums.OrderSide;
import com.slwatchdog.domain.enums.OrderType;
import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.model.ExitTranche;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.domain.model.StopLevel;
import com.slwatchdog.domain.model.TranchePlan;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.oms.ExitOrderRequest;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tranche state machine deciding whether a price tick exits part of a position.
 *
 * <p>Evaluation order per tick:
 * <ol>
 *   <li>Stop-loss tranche: fires when price crosses the stop unfavourably, as a LIMIT
 *       order {@code stop-limit-offset-pct} through the stop, rounded to the tick.</li>
 *   <li>Profit targets, highest ATR multiple first, only while the position is in
 *       profit: fires a MARKET order once {@code (price - entry) / ATR} reaches the
 *       tranche's multiple (sign inverted for SHORT). Skipped when the entry price is
 *       unknown (zero).</li>
 * </ol>
 * At most one tranche fires per tick. The engine only decides; marking a tranche
 * triggered is left to the order executor once the broker accepts the order.
 *
 * <p>Must be called inside the ledger's per-ticker atomic section: on first evaluation it
 * assigns the tranche preset for the ticker's volatility category to the position.
 */
@Slf4j
@Component
public class ExitDecisionEngine {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final TickSizeResolver tickSizeResolver;
    private final BigDecimal stopLimitOffsetPct;
    private final Clock clock;

    public ExitDecisionEngine(TickSizeResolver tickSizeResolver, WatchdogProperties watchdogProperties, Clock clock) {
        this.tickSizeResolver = tickSizeResolver;
        this.stopLimitOffsetPct = watchdogProperties.getStopLimitOffsetPct();
        this.clock = clock;
    }

    public Optional<ExitOrderRequest> evaluate(
            Position position, BigDecimal price, StopLevel stopLevel, VolatilityInfo volatility) {
        if (position.hasPendingOrder() || position.getQuantity() <= 0) {
            return Optional.empty();
        }
        if (!position.hasTranches()) {
            position.assignTranches(TranchePlan.forCategory(volatility.getCategory()));
            log.info(
                    "Exit plan assigned: ticker={}, category={}, tranches={}",
                    position.getTicker(),
                    volatility.getCategory(),
                    describe(position));
        }

        ExitTranche stopTranche = position.getExitTranches().values().stream()
                .filter(ExitTranche::isStopLoss)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No stop-loss tranche for " + position.getTicker()));

        if (!stopTranche.isTriggered() && stopLevel.isBreachedBy(price)) {
            return Optional.of(stopLossExit(position, stopTranche, price, stopLevel));
        }

        if (position.getEntryPrice() == null || position.getEntryPrice().signum() <= 0) {
            log.debug("No entry price, profit targets skipped: ticker={}", position.getTicker());
            return Optional.empty();
        }

        BigDecimal profitInAtr = profitInAtr(position, price, volatility);
        if (profitInAtr.signum() <= 0) {
            log.debug(
                    "No exit: ticker={}, price={}, stop={}, profitAtr={}",
                    position.getTicker(),
                    price,
                    stopLevel.getStopPrice(),
                    profitInAtr);
            return Optional.empty();
        }

        List<ExitTranche> targets = position.getExitTranches().values().stream()
                .filter(t -> !t.isStopLoss())
                .sorted(Comparator.comparing(ExitTranche::getProfitMultipleOfAtr).reversed())
                .toList();
        for (ExitTranche target : targets) {
            if (!target.isTriggered() && profitInAtr.compareTo(target.getProfitMultipleOfAtr()) >= 0) {
                return Optional.of(profitTargetExit(position, target, price, profitInAtr));
            }
        }
        return Optional.empty();
    }

    /**
     * Shares to exit for a tranche: {@code floor(original * pct / 100)} clamped to
     * [1, remaining]. The last untriggered tranche takes whatever remains so that
     * rounding never strands shares without an exit.
     */
    public static int trancheQuantity(Position position, ExitTranche tranche) {
        long untriggered = position.getExitTranches().values().stream()
                .filter(t -> !t.isTriggered())
                .count();
        if (untriggered == 1 && !tranche.isTriggered()) {
            return position.getQuantity();
        }
        int quantity = position.getOriginalQuantity() * tranche.getPercentOfOriginalPosition() / 100;
        return Math.max(1, Math.min(quantity, position.getQuantity()));
    }

    private ExitOrderRequest stopLossExit(
            Position position, ExitTranche tranche, BigDecimal price, StopLevel stopLevel) {
        OrderSide side = position.getSide().exitSide();
        BigDecimal offset = stopLimitOffsetPct.divide(HUNDRED, 6, RoundingMode.HALF_UP);
        BigDecimal rawLimit = position.getSide() == PositionSide.LONG
                ? stopLevel.getStopPrice().multiply(BigDecimal.ONE.subtract(offset))
                : stopLevel.getStopPrice().multiply(BigDecimal.ONE.add(offset));
        BigDecimal tick = tickSizeResolver.tickSize(position.getExchange(), position.getTicker(), rawLimit);
        BigDecimal limitPrice = TickSizeResolver.roundToTick(rawLimit, tick, side == OrderSide.SELL);
        int quantity = trancheQuantity(position, tranche);

        log.info(
                "STOP LOSS TRIGGERED: ticker={}, side={}, price={}, stop={}, tranche={} ({}%), qty={}/{}, limit={}, tick={}",
                position.getTicker(),
                position.getSide(),
                price,
                stopLevel.getStopPrice(),
                tranche.getId(),
                tranche.getPercentOfOriginalPosition(),
                quantity,
                position.getQuantity(),
                limitPrice,
                tick);

        return baseRequest(position, tranche, quantity, price)
                .orderType(OrderType.LIMIT)
                .limitPrice(limitPrice)
                .reason(ExitReason.STOP_LOSS)
                .build();
    }

    private ExitOrderRequest profitTargetExit(
            Position position, ExitTranche tranche, BigDecimal price, BigDecimal profitInAtr) {
        int quantity = trancheQuantity(position, tranche);
        log.info(
                "PROFIT TARGET REACHED: ticker={}, price={}, entry={}, profitAtr={}, tranche={} ({}% at {}x ATR), qty={}/{}",
                position.getTicker(),
                price,
                position.getEntryPrice(),
                profitInAtr,
                tranche.getId(),
                tranche.getPercentOfOriginalPosition(),
                tranche.getProfitMultipleOfAtr(),
                quantity,
                position.getQuantity());

        return baseRequest(position, tranche, quantity, price)
                .orderType(OrderType.MARKET)
                .reason(ExitReason.PROFIT_TARGET)
                .build();
    }

    private ExitOrderRequest.ExitOrderRequestBuilder baseRequest(
            Position position, ExitTranche tranche, int quantity, BigDecimal price) {
        return ExitOrderRequest.builder()
                .ticker(position.getTicker())
                .exchange(position.getExchange())
                .product(position.getProduct())
                .side(position.getSide().exitSide())
                .quantity(quantity)
                .triggerPrice(price)
                .trancheId(tranche.getId())
                .remainingQuantityAfterFill(position.getQuantity() - quantity)
                .createdAt(clock.instant())
                .correlationId(UUID.randomUUID().toString());
    }

    static BigDecimal profitInAtr(Position position, BigDecimal price, VolatilityInfo volatility) {
        if (volatility.getAtrValue() == null || volatility.getAtrValue().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal move = price.subtract(position.getEntryPrice());
        if (position.getSide() == PositionSide.SHORT) {
            move = move.negate();
        }
        return move.divide(volatility.getAtrValue(), 4, RoundingMode.HALF_UP);
    }

    private static String describe(Position position) {
        StringBuilder sb = new StringBuilder();
        for (ExitTranche t : position.getExitTranches().values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(t.getId()).append('=').append(t.getPercentOfOriginalPosition()).append('%');
            if (!t.isStopLoss()) {
                sb.append('@').append(t.getProfitMultipleOfAtr()).append("xATR");
            }
        }
        return sb.toString();
    }
}
