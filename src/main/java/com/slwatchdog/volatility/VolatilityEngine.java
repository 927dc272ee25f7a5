package com.slwatchdog.volatility;

import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.enums.VolatilityCategory;
import com.slwatchdog.domain.model.DailyCandle;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.exception.InsufficientDataException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.TRIndicator;
import org.ta4j.core.num.Num;

/**
 * Computes ATR and the volatility bucket from a contiguous daily OHLC series.
 *
 * <p>True range per bar is {@code max(high-low, |high-prevClose|, |low-prevClose|)}; ATR
 * is the simple moving average of the last {@code period} true ranges (not Wilder's
 * smoothing). Every averaged bar must have a previous close, so {@code period + 1} bars
 * are required.
 */
@Component
public class VolatilityEngine {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SCALE = 4;

    private final int period;
    private final Clock clock;

    public VolatilityEngine(WatchdogProperties watchdogProperties, Clock clock) {
        this(watchdogProperties.getAtrPeriod(), clock);
    }

    public VolatilityEngine(int period, Clock clock) {
        this.period = period;
        this.clock = clock;
    }

    public int requiredBars() {
        return period + 1;
    }

    /**
     * @param candles daily candles, oldest first
     * @throws InsufficientDataException if fewer than {@link #requiredBars()} candles are given
     */
    public VolatilityInfo compute(String ticker, List<DailyCandle> candles) {
        if (candles == null || candles.size() < requiredBars()) {
            throw new InsufficientDataException(ticker, candles == null ? 0 : candles.size(), requiredBars());
        }

        BarSeries series = toSeries(ticker, candles);
        int lastIndex = series.getEndIndex();
        Num atr = new SMAIndicator(new TRIndicator(series), period).getValue(lastIndex);

        DailyCandle latest = candles.get(candles.size() - 1);
        BigDecimal atrValue = BigDecimal.valueOf(atr.doubleValue()).setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal atrPercent = latest.getClose().signum() > 0
                ? atrValue.multiply(HUNDRED).divide(latest.getClose(), SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        VolatilityCategory category = VolatilityCategory.classify(atrPercent);

        return VolatilityInfo.builder()
                .ticker(ticker)
                .atrValue(atrValue)
                .atrPercent(atrPercent)
                .category(category)
                .stopMultiplier(category.getStopMultiplier())
                .dailyHigh(latest.getHigh())
                .dailyLow(latest.getLow())
                .latestClose(latest.getClose())
                .computedAt(clock.instant())
                .build();
    }

    private BarSeries toSeries(String ticker, List<DailyCandle> candles) {
        BarSeries series = new BaseBarSeriesBuilder().withName(ticker).build();
        for (DailyCandle candle : candles) {
            series.addBar(
                    candle.getDate().plusDays(1).atStartOfDay(IST),
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume());
        }
        return series;
    }
}
