package com.slwatchdog.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.enums.ExitReason;
import com.slwatchdog.domain.enums.OrderSide;
import com.slwatchdog.domain.enums.OrderType;
import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.VolatilityCategory;
import com.slwatchdog.domain.model.ExitTranche;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.domain.model.StopLevel;
import com.slwatchdog.domain.model.TranchePlan;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.exit.ExitDecisionEngine;
import com.slwatchdog.exit.TickSizeResolver;
import com.slwatchdog.instrument.InstrumentService;
import com.slwatchdog.oms.ExitOrderRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for ExitDecisionEngine: stop-loss firing and limit pricing, profit-target
 * ordering, tranche sizing and the pending-order gate.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExitDecisionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-10T06:00:00Z");

    @Mock
    private InstrumentService instrumentService;

    private WatchdogProperties watchdogProperties;
    private ExitDecisionEngine engine;

    @BeforeEach
    void setUp() {
        when(instrumentService.findTickSize(anyString(), anyString())).thenReturn(Optional.empty());
        watchdogProperties = new WatchdogProperties();
        watchdogProperties.getTickSizeOverrides().put("AIAENG", new BigDecimal("0.10"));
        TickSizeResolver tickSizeResolver = new TickSizeResolver(watchdogProperties, instrumentService);
        engine = new ExitDecisionEngine(tickSizeResolver, watchdogProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Position position(String ticker, PositionSide side, int quantity, String entry) {
        return Position.builder()
                .ticker(ticker)
                .exchange("NSE")
                .product("CNC")
                .side(side)
                .quantity(quantity)
                .originalQuantity(quantity)
                .entryPrice(new BigDecimal(entry))
                .build();
    }

    private static VolatilityInfo medium(String atr) {
        return VolatilityInfo.builder()
                .ticker("INFY")
                .atrValue(new BigDecimal(atr))
                .atrPercent(new BigDecimal("3"))
                .category(VolatilityCategory.MEDIUM)
                .stopMultiplier(VolatilityCategory.MEDIUM.getStopMultiplier())
                .dailyHigh(new BigDecimal("110"))
                .dailyLow(new BigDecimal("100"))
                .build();
    }

    private static StopLevel stop(String ticker, PositionSide side, String stopPrice) {
        return new StopLevel(ticker, side, new BigDecimal("110"), new BigDecimal(stopPrice), NOW);
    }

    @Nested
    @DisplayName("Stop-loss tranche")
    class StopLoss {

        @Test
        @DisplayName("LONG at stop 95: 96 holds, 94 fires a 40% SELL LIMIT at 94.50")
        void longStopFires() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");
            StopLevel stopLevel = stop("INFY", PositionSide.LONG, "95");

            Optional<ExitOrderRequest> at96 = engine.evaluate(position, new BigDecimal("96"), stopLevel, medium("10"));
            Optional<ExitOrderRequest> at94 = engine.evaluate(position, new BigDecimal("94"), stopLevel, medium("10"));

            assertThat(at96).isEmpty();
            assertThat(at94).isPresent();
            ExitOrderRequest request = at94.get();
            assertThat(request.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(request.getOrderType()).isEqualTo(OrderType.LIMIT);
            assertThat(request.getReason()).isEqualTo(ExitReason.STOP_LOSS);
            assertThat(request.getTrancheId()).isEqualTo(ExitTranche.STOP_LOSS_ID);
            assertThat(request.getQuantity()).isEqualTo(40);
            assertThat(request.getRemainingQuantityAfterFill()).isEqualTo(60);
            assertThat(request.getLimitPrice()).isEqualByComparingTo("94.50");
            assertThat(request.getTriggerPrice()).isEqualByComparingTo("94");
            assertThat(request.getCorrelationId()).isNotBlank();
            assertThat(request.getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Price exactly at the stop counts as a breach")
        void touchIsBreach() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");

            assertThat(engine.evaluate(position, new BigDecimal("95"), stop("INFY", PositionSide.LONG, "95"), medium("10")))
                    .isPresent();
        }

        @Test
        @DisplayName("SHORT at stop 105: 106 fires a BUY LIMIT rounded up to 105.55")
        void shortStopFires() {
            Position position = position("INFY", PositionSide.SHORT, 50, "100");

            ExitOrderRequest request = engine.evaluate(
                            position, new BigDecimal("106"), stop("INFY", PositionSide.SHORT, "105"), medium("10"))
                    .orElseThrow();

            assertThat(request.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(request.getLimitPrice()).isEqualByComparingTo("105.55");
            assertThat(request.getQuantity()).isEqualTo(20);
        }

        @Test
        @DisplayName("Configured tick override is used for the limit price")
        void tickOverride() {
            Position position = position("AIAENG", PositionSide.LONG, 10, "1100");

            ExitOrderRequest request = engine.evaluate(
                            position, new BigDecimal("1000"), stop("AIAENG", PositionSide.LONG, "1001"), medium("30"))
                    .orElseThrow();

            // 1001 * 0.995 = 995.995, floored to the 0.10 grid
            assertThat(request.getLimitPrice()).isEqualByComparingTo("995.90");
        }

        @Test
        @DisplayName("A triggered stop-loss tranche does not fire again")
        void stopFiresOnce() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");
            position.assignTranches(TranchePlan.forCategory(VolatilityCategory.MEDIUM));
            position.triggerTranche(ExitTranche.STOP_LOSS_ID);
            position.setQuantity(60);

            assertThat(engine.evaluate(position, new BigDecimal("90"), stop("INFY", PositionSide.LONG, "95"), medium("10")))
                    .isEmpty();
        }
    }

    @Nested
    @DisplayName("Profit targets")
    class ProfitTargets {

        @Test
        @DisplayName("Highest eligible multiple fires first, one tranche per tick")
        void highestMultipleFirst() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");
            StopLevel stopLevel = stop("INFY", PositionSide.LONG, "130");

            // 4.5 ATR in profit: both 2.5x and 4.0x are eligible
            ExitOrderRequest first = engine.evaluate(position, new BigDecimal("145"), stopLevel, medium("10"))
                    .orElseThrow();
            position.triggerTranche(first.getTrancheId());
            position.setQuantity(position.getQuantity() - first.getQuantity());
            ExitOrderRequest second = engine.evaluate(position, new BigDecimal("145"), stopLevel, medium("10"))
                    .orElseThrow();

            assertThat(first.getTrancheId()).isEqualTo("profit_target_2");
            assertThat(first.getOrderType()).isEqualTo(OrderType.MARKET);
            assertThat(first.getLimitPrice()).isNull();
            assertThat(first.getReason()).isEqualTo(ExitReason.PROFIT_TARGET);
            assertThat(first.getQuantity()).isEqualTo(30);
            assertThat(second.getTrancheId()).isEqualTo("profit_target_1");
            assertThat(second.getQuantity()).isEqualTo(30);
        }

        @Test
        @DisplayName("Below the lowest multiple nothing fires")
        void belowThreshold() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");

            assertThat(engine.evaluate(position, new BigDecimal("124"), stop("INFY", PositionSide.LONG, "95"), medium("10")))
                    .isEmpty();
            assertThat(position.hasTranches()).isTrue();
        }

        @Test
        @DisplayName("SHORT profit is measured downward")
        void shortProfit() {
            Position position = position("INFY", PositionSide.SHORT, 100, "100");

            ExitOrderRequest request = engine.evaluate(
                            position, new BigDecimal("74"), stop("INFY", PositionSide.SHORT, "90"), medium("10"))
                    .orElseThrow();

            assertThat(request.getTrancheId()).isEqualTo("profit_target_1");
            assertThat(request.getSide()).isEqualTo(OrderSide.BUY);
        }

        @Test
        @DisplayName("Unknown entry price: no profit target fires, the stop still does")
        void zeroEntrySkipsTargets() {
            Position position = position("INFY", PositionSide.LONG, 5, "0");

            Optional<ExitOrderRequest> farAbove = engine.evaluate(
                    position, new BigDecimal("4000"), stop("INFY", PositionSide.LONG, "3800"), medium("60"));
            Optional<ExitOrderRequest> belowStop = engine.evaluate(
                    position, new BigDecimal("3790"), stop("INFY", PositionSide.LONG, "3800"), medium("60"));

            assertThat(farAbove).isEmpty();
            assertThat(belowStop).get().extracting(ExitOrderRequest::getReason).isEqualTo(ExitReason.STOP_LOSS);
        }
    }

    @Nested
    @DisplayName("Tranche sizing")
    class Sizing {

        @Test
        @DisplayName("Small positions exit at least one share")
        void minimumOneShare() {
            Position position = position("MRF", PositionSide.LONG, 1, "100000");
            position.assignTranches(TranchePlan.forCategory(VolatilityCategory.MEDIUM));

            assertThat(ExitDecisionEngine.trancheQuantity(position, position.getExitTranches().get("profit_target_1")))
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("The last open tranche takes everything that remains")
        void lastTrancheTakesRemainder() {
            Position position = position("INFY", PositionSide.LONG, 7, "100");
            position.assignTranches(TranchePlan.forCategory(VolatilityCategory.LOW));
            position.triggerTranche(ExitTranche.STOP_LOSS_ID);
            position.triggerTranche("profit_target_1");
            position.setQuantity(2);

            assertThat(ExitDecisionEngine.trancheQuantity(position, position.getExitTranches().get("profit_target_2")))
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("Tranche size is capped at the remaining quantity")
        void cappedAtRemaining() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");
            position.assignTranches(TranchePlan.forCategory(VolatilityCategory.LOW));
            position.setQuantity(10);

            assertThat(ExitDecisionEngine.trancheQuantity(position, position.getExitTranches().get(ExitTranche.STOP_LOSS_ID)))
                    .isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Pending gate")
    class PendingGate {

        @Test
        @DisplayName("No decision while an order is pending")
        void pendingBlocksEvaluation() {
            Position position = position("INFY", PositionSide.LONG, 100, "100");
            position.setPendingOrder(true);

            assertThat(engine.evaluate(position, new BigDecimal("80"), stop("INFY", PositionSide.LONG, "95"), medium("10")))
                    .isEmpty();
        }
    }
}
