package com.slwatchdog.exit;

import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.instrument.InstrumentService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the exchange tick size for a symbol and rounds prices onto it.
 *
 * <p>Lookup order: configured overrides, the cached instrument dump (never downloaded
 * here), then NSE price bands:
 * <pre>
 * price &lt; 50       0.01
 * price &lt; 500      0.05
 * price &lt; 1000     0.10
 * price &lt; 5000     0.25
 * price &lt; 10000    0.50
 * otherwise        1.00
 * </pre>
 */
@Slf4j
@Component
public class TickSizeResolver {

    static final BigDecimal DEFAULT_TICK = new BigDecimal("0.05");

    private final Map<String, BigDecimal> overrides;
    private final InstrumentService instrumentService;
    private final Map<String, BigDecimal> resolved = new ConcurrentHashMap<>();

    public TickSizeResolver(WatchdogProperties watchdogProperties, InstrumentService instrumentService) {
        this.overrides = new ConcurrentHashMap<>();
        watchdogProperties.getTickSizeOverrides().forEach((k, v) -> overrides.put(k.toUpperCase(Locale.ROOT), v));
        this.instrumentService = instrumentService;
    }

    public BigDecimal tickSize(String exchange, String ticker, BigDecimal price) {
        BigDecimal override = overrides.get(ticker.toUpperCase(Locale.ROOT));
        if (override != null) {
            return override;
        }
        BigDecimal cached = resolved.get(ticker);
        if (cached != null) {
            return cached;
        }
        Optional<BigDecimal> fromInstruments = instrumentService.findTickSize(exchange, ticker);
        if (fromInstruments.isPresent()) {
            resolved.put(ticker, fromInstruments.get());
            return fromInstruments.get();
        }
        log.debug("No cached instrument tick for {}, using price band", ticker);
        return priceBand(price);
    }

    /**
     * Rounds onto the tick grid in the direction that favours a fill: down for a SELL
     * limit, up for a BUY limit.
     */
    public static BigDecimal roundToTick(BigDecimal price, BigDecimal tickSize, boolean roundDown) {
        BigDecimal tick = tickSize != null && tickSize.signum() > 0 ? tickSize : DEFAULT_TICK;
        BigDecimal ticks = price.divide(tick, 0, roundDown ? RoundingMode.FLOOR : RoundingMode.CEILING);
        return ticks.multiply(tick).setScale(Math.max(tick.stripTrailingZeros().scale(), 2), RoundingMode.HALF_UP);
    }

    static BigDecimal priceBand(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            return DEFAULT_TICK;
        }
        double p = price.doubleValue();
        if (p < 50) {
            return new BigDecimal("0.01");
        }
        if (p < 500) {
            return new BigDecimal("0.05");
        }
        if (p < 1000) {
            return new BigDecimal("0.10");
        }
        if (p < 5000) {
            return new BigDecimal("0.25");
        }
        if (p < 10000) {
            return new BigDecimal("0.50");
        }
        return new BigDecimal("1.00");
    }
}
