package com.slwatchdog.volatility;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.model.DailyCandle;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.exception.BaseException;
import com.slwatchdog.exception.InstrumentNotFoundException;
import com.slwatchdog.exception.InsufficientDataException;
import com.slwatchdog.instrument.InstrumentService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the latest {@link VolatilityInfo} per ticker and decides when to recompute it.
 *
 * <p>A ticker is computed immediately the first time it is seen and then at most once
 * per {@code watchdog.volatility-refresh} (24h by default). Failures never clear an
 * existing reading: insufficient history, unknown instruments and broker errors are
 * logged and the previous value stays in use until the next attempt.
 */
@Slf4j
@Service
public class VolatilityService {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final BrokerGateway brokerGateway;
    private final InstrumentService instrumentService;
    private final VolatilityEngine volatilityEngine;
    private final WatchdogProperties watchdogProperties;
    private final Clock clock;

    private final Map<String, VolatilityInfo> readings = new ConcurrentHashMap<>();

    /** Last attempt per ticker, successful or not, so failing tickers are not hammered every tick. */
    private final Map<String, Instant> lastAttempt = new ConcurrentHashMap<>();

    public VolatilityService(
            BrokerGateway brokerGateway,
            InstrumentService instrumentService,
            VolatilityEngine volatilityEngine,
            WatchdogProperties watchdogProperties,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.instrumentService = instrumentService;
        this.volatilityEngine = volatilityEngine;
        this.watchdogProperties = watchdogProperties;
        this.clock = clock;
    }

    public Optional<VolatilityInfo> get(String ticker) {
        return Optional.ofNullable(readings.get(ticker));
    }

    /** Returns true if a recomputation is due for the ticker at {@code now}. */
    public boolean isDue(String ticker, Instant now) {
        Instant attempted = lastAttempt.get(ticker);
        if (attempted == null) {
            return true;
        }
        if (!readings.containsKey(ticker)) {
            // never succeeded: retry on the reconcile cadence rather than every tick
            return Duration.between(attempted, now).compareTo(watchdogProperties.getReconcileInterval()) >= 0;
        }
        return Duration.between(attempted, now).compareTo(watchdogProperties.getVolatilityRefresh()) >= 0;
    }

    /**
     * Recomputes the ticker's reading if due.
     *
     * @return the current reading after the attempt, possibly the previous one
     */
    public Optional<VolatilityInfo> refreshIfDue(Position position) {
        Instant now = clock.instant();
        if (isDue(position.getTicker(), now)) {
            refresh(position, now);
        }
        return get(position.getTicker());
    }

    /** Forces a recomputation for every given position, used by the daily refresh. */
    public void refreshAll(List<Position> positions) {
        Instant now = clock.instant();
        for (Position position : positions) {
            if (isDue(position.getTicker(), now)) {
                refresh(position, now);
            }
        }
    }

    public void forget(String ticker) {
        readings.remove(ticker);
        lastAttempt.remove(ticker);
    }

    private void refresh(Position position, Instant now) {
        String ticker = position.getTicker();
        lastAttempt.put(ticker, now);
        try {
            long token = position.getInstrumentToken() != null
                    ? position.getInstrumentToken()
                    : instrumentService.resolveToken(position.getExchange(), ticker);
            LocalDate to = now.atZone(IST).toLocalDate();
            LocalDate from = to.minusDays(watchdogProperties.getHistoryDays());
            List<DailyCandle> candles = brokerGateway.getDailyCandles(token, from, to);

            VolatilityInfo info = volatilityEngine.compute(ticker, candles);
            VolatilityInfo previous = readings.put(ticker, info);
            log.info(
                    "Volatility updated: ticker={}, atr={}, atrPct={}%, category={}, multiplier={}, dailyHigh={}, previousCategory={}",
                    ticker,
                    info.getAtrValue(),
                    info.getAtrPercent(),
                    info.getCategory(),
                    info.getStopMultiplier(),
                    info.getDailyHigh(),
                    previous != null ? previous.getCategory() : "none");
        } catch (InsufficientDataException e) {
            log.warn("Volatility skipped, keeping previous reading: ticker={}, reason={}", ticker, e.getMessage());
        } catch (InstrumentNotFoundException e) {
            log.warn("Volatility skipped, instrument unresolved: ticker={}, reason={}", ticker, e.getMessage());
        } catch (BaseException e) {
            log.warn("Volatility refresh failed: ticker={}, code={}, reason={}", ticker, e.getErrorCode(), e.getMessage());
        }
    }
}
