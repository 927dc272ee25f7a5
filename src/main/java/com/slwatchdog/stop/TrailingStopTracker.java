package com.slwatchdog.stop;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.model.StopLevel;
import com.slwatchdog.domain.model.VolatilityInfo;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-ticker trailing stop.
 *
 * <p>For LONG the extreme is the highest price seen (seeded with the latest daily high)
 * and the stop is {@code extreme - ATR * multiplier}; SHORT mirrors this with the lowest
 * price. The stop only moves in the position's favour: a new candidate is combined with
 * the previous stop via max (LONG) or min (SHORT), and the first stop for a ticker is
 * combined with its persisted watermark so a restart cannot loosen it.
 */
@Slf4j
@Component
public class TrailingStopTracker {

    private static final int SCALE = 4;

    private final StopWatermarkService stopWatermarkService;
    private final Clock clock;

    private final Map<String, StopLevel> levels = new ConcurrentHashMap<>();

    public TrailingStopTracker(StopWatermarkService stopWatermarkService, Clock clock) {
        this.stopWatermarkService = stopWatermarkService;
        this.clock = clock;
    }

    /**
     * Folds a new price into the ticker's extreme and recomputes the stop.
     *
     * @return the stop level after this observation
     */
    public StopLevel onPrice(String ticker, PositionSide side, BigDecimal price, VolatilityInfo volatility) {
        StopLevel[] before = new StopLevel[1];
        StopLevel after = levels.compute(ticker, (key, previous) -> {
            before[0] = previous;
            StopLevel base = previous != null && previous.getSide() == side ? previous : seed(ticker, side, volatility);
            return next(base, side, price, volatility);
        });

        BigDecimal previousStop = before[0] != null ? before[0].getStopPrice() : null;
        if (previousStop == null || after.getStopPrice().compareTo(previousStop) != 0) {
            stopWatermarkService.raise(ticker, side, after.getStopPrice());
            log.info(
                    "Stop moved: ticker={}, side={}, price={}, extreme={}, stop={} (was {}), atr={}, multiplier={}",
                    ticker,
                    side,
                    price,
                    after.getExtreme(),
                    after.getStopPrice(),
                    previousStop,
                    volatility.getAtrValue(),
                    volatility.getStopMultiplier());
        }
        return after;
    }

    public Optional<StopLevel> current(String ticker) {
        return Optional.ofNullable(levels.get(ticker));
    }

    /** Drops in-memory state and the persisted watermark of a fully exited ticker. */
    public void onPositionClosed(String ticker) {
        levels.remove(ticker);
        stopWatermarkService.clear(ticker);
    }

    private StopLevel seed(String ticker, PositionSide side, VolatilityInfo volatility) {
        BigDecimal extreme = side == PositionSide.LONG ? volatility.getDailyHigh() : volatility.getDailyLow();
        BigDecimal watermark = stopWatermarkService.find(ticker, side).orElse(null);
        if (watermark != null) {
            log.info("Restored stop watermark: ticker={}, side={}, stop={}", ticker, side, watermark);
        }
        return new StopLevel(ticker, side, extreme, watermark, clock.instant());
    }

    private StopLevel next(StopLevel base, PositionSide side, BigDecimal price, VolatilityInfo volatility) {
        BigDecimal extreme = favourable(side, base.getExtreme(), price);
        BigDecimal distance = volatility.stopDistance();
        BigDecimal candidate = (side == PositionSide.LONG ? extreme.subtract(distance) : extreme.add(distance))
                .setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal stop = base.getStopPrice() == null ? candidate : favourable(side, base.getStopPrice(), candidate);
        return new StopLevel(base.getTicker(), side, extreme, stop, clock.instant());
    }

    /** The better of two prices for the side: max for LONG, min for SHORT. Nulls lose. */
    static BigDecimal favourable(PositionSide side, BigDecimal a, BigDecimal b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        if (side == PositionSide.LONG) {
            return a.max(b);
        }
        return a.min(b);
    }
}
