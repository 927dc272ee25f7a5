package com.slwatchdog.unit.stop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.VolatilityCategory;
import com.slwatchdog.domain.model.StopLevel;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.stop.StopWatermarkService;
import com.slwatchdog.stop.TrailingStopTracker;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Random;
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
 * Unit tests for TrailingStopTracker: extreme tracking, stop monotonicity for both sides,
 * and watermark restore/persist behaviour.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TrailingStopTrackerTest {

    @Mock
    private StopWatermarkService stopWatermarkService;

    private TrailingStopTracker tracker;

    @BeforeEach
    void setUp() {
        when(stopWatermarkService.find(anyString(), any())).thenReturn(Optional.empty());
        tracker = new TrailingStopTracker(stopWatermarkService, Clock.fixed(Instant.parse("2026-03-10T05:00:00Z"), ZoneOffset.UTC));
    }

    private static VolatilityInfo volatility(String atr, VolatilityCategory category, String dailyHigh, String dailyLow) {
        return VolatilityInfo.builder()
                .ticker("INFY")
                .atrValue(new BigDecimal(atr))
                .atrPercent(new BigDecimal("3"))
                .category(category)
                .stopMultiplier(category.getStopMultiplier())
                .dailyHigh(new BigDecimal(dailyHigh))
                .dailyLow(new BigDecimal(dailyLow))
                .latestClose(new BigDecimal(dailyHigh))
                .build();
    }

    private static BigDecimal price(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("LONG positions")
    class LongPositions {

        @Test
        @DisplayName("ATR 10 x 1.5: high 100 -> 110 -> 105 keeps the stop at 95")
        void stopHoldsWhenPriceFallsBack() {
            VolatilityInfo vol = volatility("10", VolatilityCategory.MEDIUM, "100", "95");

            StopLevel first = tracker.onPrice("INFY", PositionSide.LONG, price("100"), vol);
            StopLevel second = tracker.onPrice("INFY", PositionSide.LONG, price("110"), vol);
            StopLevel third = tracker.onPrice("INFY", PositionSide.LONG, price("105"), vol);

            assertThat(first.getStopPrice()).isEqualByComparingTo("85");
            assertThat(second.getExtreme()).isEqualByComparingTo("110");
            assertThat(second.getStopPrice()).isEqualByComparingTo("95");
            assertThat(third.getExtreme()).isEqualByComparingTo("110");
            assertThat(third.getStopPrice()).isEqualByComparingTo("95");
        }

        @Test
        @DisplayName("Extreme is seeded from the daily high, not the first price")
        void seededFromDailyHigh() {
            VolatilityInfo vol = volatility("10", VolatilityCategory.MEDIUM, "120", "100");

            StopLevel level = tracker.onPrice("INFY", PositionSide.LONG, price("112"), vol);

            assertThat(level.getExtreme()).isEqualByComparingTo("120");
            assertThat(level.getStopPrice()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("Stop never decreases when volatility widens")
        void wideningAtrDoesNotLoosen() {
            tracker.onPrice("INFY", PositionSide.LONG, price("110"), volatility("10", VolatilityCategory.MEDIUM, "110", "100"));

            StopLevel after = tracker.onPrice(
                    "INFY", PositionSide.LONG, price("110"), volatility("20", VolatilityCategory.HIGH, "110", "100"));

            assertThat(after.getStopPrice()).isEqualByComparingTo("95");
        }

        @Test
        @DisplayName("Random walk never lowers the stop")
        void monotonicOverRandomWalk() {
            VolatilityInfo vol = volatility("4", VolatilityCategory.MEDIUM, "100", "96");
            Random random = new Random(42);
            BigDecimal current = price("100");
            BigDecimal previousStop = null;
            for (int i = 0; i < 500; i++) {
                current = current.add(BigDecimal.valueOf(random.nextInt(41) - 20, 1));
                StopLevel level = tracker.onPrice("INFY", PositionSide.LONG, current, vol);
                if (previousStop != null) {
                    assertThat(level.getStopPrice()).isGreaterThanOrEqualTo(previousStop);
                }
                previousStop = level.getStopPrice();
            }
        }
    }

    @Nested
    @DisplayName("SHORT positions")
    class ShortPositions {

        @Test
        @DisplayName("Stop trails the lowest price and never rises")
        void trailsLow() {
            VolatilityInfo vol = volatility("10", VolatilityCategory.MEDIUM, "105", "100");

            StopLevel first = tracker.onPrice("INFY", PositionSide.SHORT, price("100"), vol);
            StopLevel second = tracker.onPrice("INFY", PositionSide.SHORT, price("90"), vol);
            StopLevel third = tracker.onPrice("INFY", PositionSide.SHORT, price("95"), vol);

            assertThat(first.getStopPrice()).isEqualByComparingTo("115");
            assertThat(second.getStopPrice()).isEqualByComparingTo("105");
            assertThat(third.getExtreme()).isEqualByComparingTo("90");
            assertThat(third.getStopPrice()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("Breach is a price at or above the stop")
        void breachDirection() {
            StopLevel level = tracker.onPrice(
                    "INFY", PositionSide.SHORT, price("100"), volatility("10", VolatilityCategory.MEDIUM, "105", "100"));

            assertThat(level.isBreachedBy(price("115"))).isTrue();
            assertThat(level.isBreachedBy(price("114.95"))).isFalse();
        }
    }

    @Nested
    @DisplayName("Watermark persistence")
    class Watermark {

        @Test
        @DisplayName("Restored watermark above the computed stop wins after restart")
        void restoredWatermarkWins() {
            when(stopWatermarkService.find("INFY", PositionSide.LONG)).thenReturn(Optional.of(price("97")));

            StopLevel level = tracker.onPrice(
                    "INFY", PositionSide.LONG, price("100"), volatility("10", VolatilityCategory.MEDIUM, "100", "95"));

            assertThat(level.getStopPrice()).isEqualByComparingTo("97");
        }

        @Test
        @DisplayName("Every stop change is written; an unchanged stop is not")
        void persistsOnlyChanges() {
            VolatilityInfo vol = volatility("10", VolatilityCategory.MEDIUM, "100", "95");

            tracker.onPrice("INFY", PositionSide.LONG, price("100"), vol);
            tracker.onPrice("INFY", PositionSide.LONG, price("110"), vol);
            tracker.onPrice("INFY", PositionSide.LONG, price("105"), vol);

            verify(stopWatermarkService, times(2)).raise(eq("INFY"), eq(PositionSide.LONG), any(BigDecimal.class));
            verify(stopWatermarkService)
                    .raise(eq("INFY"), eq(PositionSide.LONG), argThat(p -> p.compareTo(price("95")) == 0));
        }

        @Test
        @DisplayName("Closing a position clears memory and the stored watermark")
        void closeClearsState() {
            tracker.onPrice("INFY", PositionSide.LONG, price("100"), volatility("10", VolatilityCategory.MEDIUM, "100", "95"));

            tracker.onPositionClosed("INFY");

            assertThat(tracker.current("INFY")).isEmpty();
            verify(stopWatermarkService).clear("INFY");
            verify(stopWatermarkService, never()).clear("TCS");
        }
    }
}
