package com.slwatchdog.unit.volatility;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.slwatchdog.domain.enums.VolatilityCategory;
import com.slwatchdog.domain.model.DailyCandle;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.exception.ErrorCode;
import com.slwatchdog.exception.InsufficientDataException;
import com.slwatchdog.volatility.VolatilityEngine;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for VolatilityEngine: ATR as the simple average of true range over 20 bars,
 * category thresholds, and the minimum bar requirement.
 */
class VolatilityEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-10T04:00:00Z");
    private static final LocalDate START = LocalDate.of(2026, 1, 1);

    private VolatilityEngine volatilityEngine;

    @BeforeEach
    void setUp() {
        volatilityEngine = new VolatilityEngine(20, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static DailyCandle candle(int day, String high, String low, String close) {
        return DailyCandle.builder()
                .date(START.plusDays(day))
                .open(new BigDecimal(close))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .volume(10_000)
                .build();
    }

    private static List<DailyCandle> flat(int count, String high, String low, String close) {
        List<DailyCandle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(candle(i, high, low, close));
        }
        return candles;
    }

    @Nested
    @DisplayName("ATR computation")
    class AtrComputation {

        @Test
        @DisplayName("Constant 10-point range gives ATR 10")
        void constantRange() {
            VolatilityInfo info = volatilityEngine.compute("INFY", flat(21, "110", "100", "105"));

            assertThat(info.getAtrValue()).isEqualByComparingTo("10");
            assertThat(info.getTicker()).isEqualTo("INFY");
            assertThat(info.getComputedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Gap from previous close widens the true range of the last bar")
        void gapUsesPreviousClose() {
            List<DailyCandle> candles = flat(20, "101", "99", "100");
            candles.add(candle(20, "112", "108", "110"));

            VolatilityInfo info = volatilityEngine.compute("GAPPY", candles);

            // 19 bars with TR 2 plus one bar with TR |112 - 100| = 12, averaged over 20
            assertThat(info.getAtrValue()).isEqualByComparingTo("2.5");
        }

        @Test
        @DisplayName("Only the most recent 20 true ranges are averaged")
        void usesLatestWindowOnly() {
            List<DailyCandle> candles = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                candles.add(candle(i, "150", "50", "100"));
            }
            for (int i = 10; i < 31; i++) {
                candles.add(candle(i, "101", "99", "100"));
            }

            VolatilityInfo info = volatilityEngine.compute("CALM", candles);

            assertThat(info.getAtrValue()).isEqualByComparingTo("2");
        }

        @Test
        @DisplayName("Daily high, low and close come from the latest bar")
        void latestBarSeedsExtremes() {
            List<DailyCandle> candles = flat(20, "101", "99", "100");
            candles.add(candle(20, "104", "98", "103"));

            VolatilityInfo info = volatilityEngine.compute("TCS", candles);

            assertThat(info.getDailyHigh()).isEqualByComparingTo("104");
            assertThat(info.getDailyLow()).isEqualByComparingTo("98");
            assertThat(info.getLatestClose()).isEqualByComparingTo("103");
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("ATR below 2% of close is LOW with multiplier 1.0")
        void lowVolatility() {
            VolatilityInfo info = volatilityEngine.compute("HDFCBANK", flat(21, "101", "100", "100.5"));

            assertThat(info.getCategory()).isEqualTo(VolatilityCategory.LOW);
            assertThat(info.getStopMultiplier()).isEqualByComparingTo("1.0");
        }

        @Test
        @DisplayName("ATR of 3% is MEDIUM with multiplier 1.5")
        void mediumVolatility() {
            VolatilityInfo info = volatilityEngine.compute("SBIN", flat(21, "103", "100", "100"));

            assertThat(info.getAtrPercent()).isEqualByComparingTo("3");
            assertThat(info.getCategory()).isEqualTo(VolatilityCategory.MEDIUM);
            assertThat(info.getStopMultiplier()).isEqualByComparingTo("1.5");
        }

        @Test
        @DisplayName("ATR above 4% is HIGH with multiplier 2.0")
        void highVolatility() {
            VolatilityInfo info = volatilityEngine.compute("ADANIENT", flat(21, "110", "100", "105"));

            assertThat(info.getCategory()).isEqualTo(VolatilityCategory.HIGH);
            assertThat(info.getStopMultiplier()).isEqualByComparingTo("2.0");
        }

        @Test
        @DisplayName("Boundaries: exactly 2% and exactly 4% are MEDIUM")
        void boundaries() {
            assertThat(VolatilityCategory.classify(new BigDecimal("1.9999"))).isEqualTo(VolatilityCategory.LOW);
            assertThat(VolatilityCategory.classify(new BigDecimal("2"))).isEqualTo(VolatilityCategory.MEDIUM);
            assertThat(VolatilityCategory.classify(new BigDecimal("4.0"))).isEqualTo(VolatilityCategory.MEDIUM);
            assertThat(VolatilityCategory.classify(new BigDecimal("4.0001"))).isEqualTo(VolatilityCategory.HIGH);
        }
    }

    @Nested
    @DisplayName("Insufficient data")
    class InsufficientData {

        @Test
        @DisplayName("Twenty bars are rejected: 21 are needed")
        void twentyBarsRejected() {
            assertThatThrownBy(() -> volatilityEngine.compute("NEWIPO", flat(20, "110", "100", "105")))
                    .isInstanceOf(InsufficientDataException.class)
                    .hasMessageContaining("NEWIPO")
                    .satisfies(e -> assertThat(((InsufficientDataException) e).getErrorCode())
                            .isEqualTo(ErrorCode.INSUFFICIENT_DATA));
        }

        @Test
        @DisplayName("Null candle list is rejected")
        void nullRejected() {
            assertThatThrownBy(() -> volatilityEngine.compute("X", null))
                    .isInstanceOf(InsufficientDataException.class);
        }

        @Test
        @DisplayName("Required bars is the ATR period plus one")
        void requiredBars() {
            assertThat(volatilityEngine.requiredBars()).isEqualTo(21);
        }
    }
}
