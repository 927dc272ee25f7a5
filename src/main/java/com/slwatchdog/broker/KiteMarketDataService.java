package com.slwatchdog.broker;

import com.slwatchdog.broker.mapper.KiteMarketDataMapper;
import com.slwatchdog.domain.model.DailyCandle;
import com.slwatchdog.domain.model.InstrumentInfo;
import com.slwatchdog.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.HistoricalData;
import com.zerodhatech.models.LTPQuote;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Internal service for Kite REST market data: LTP quotes, daily candles and the
 * instrument dump. Only {@link KiteBrokerGateway} calls it.
 *
 * <p>Read calls share the {@code kiteQuotes} rate limiter and the {@code kiteApi}
 * circuit breaker and retry. Rate-limit and authentication errors are not retried by
 * resilience4j (see {@code application.properties}).
 */
@Service
public class KiteMarketDataService {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataService.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final String DAY_INTERVAL = "day";

    private final KiteConnect kiteConnect;
    private final KiteMarketDataMapper kiteMarketDataMapper;

    public KiteMarketDataService(KiteConnect kiteConnect, KiteMarketDataMapper kiteMarketDataMapper) {
        this.kiteConnect = kiteConnect;
        this.kiteMarketDataMapper = kiteMarketDataMapper;
    }

    /**
     * Fetches LTP for one batch of {@code EXCHANGE:SYMBOL} keys.
     *
     * @throws BrokerException (or a subtype) if the API call fails
     */
    @RateLimiter(name = "kiteQuotes")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public Map<String, BigDecimal> getLastPrices(List<String> exchangeSymbols) {
        if (exchangeSymbols.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, LTPQuote> quotes = kiteConnect.getLTP(exchangeSymbols.toArray(String[]::new));
            Map<String, BigDecimal> prices = new HashMap<>();
            if (quotes != null) {
                quotes.forEach((key, quote) -> {
                    if (quote != null && quote.lastPrice > 0) {
                        prices.put(key, BigDecimal.valueOf(quote.lastPrice));
                    }
                });
            }
            return prices;
        } catch (KiteException e) {
            log.error("Failed to fetch LTP for {} symbols: {}", exchangeSymbols.size(), e.message);
            throw KiteErrorTranslator.translate("LTP fetch", e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching LTP for {} symbols", exchangeSymbols.size(), e);
            throw new BrokerException("Error fetching LTP: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteHistorical")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<DailyCandle> getDailyCandles(long instrumentToken, LocalDate from, LocalDate to) {
        Date fromDate = Date.from(from.atStartOfDay(IST).toInstant());
        Date toDate = Date.from(to.plusDays(1).atStartOfDay(IST).minusSeconds(1).toInstant());
        try {
            HistoricalData data = kiteConnect.getHistoricalData(
                    fromDate, toDate, String.valueOf(instrumentToken), DAY_INTERVAL, false, false);
            return kiteMarketDataMapper.toDailyCandles(data);
        } catch (KiteException e) {
            log.error("Failed to fetch daily candles for token {}: {}", instrumentToken, e.message);
            throw KiteErrorTranslator.translate("Historical data fetch", e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching daily candles for token {}", instrumentToken, e);
            throw new BrokerException("Error fetching historical data: " + e.getMessage(), e);
        }
    }

    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<InstrumentInfo> getInstruments(String exchange) {
        try {
            return kiteMarketDataMapper.toInstrumentInfos(kiteConnect.getInstruments(exchange));
        } catch (KiteException e) {
            log.error("Failed to fetch instruments for {}: {}", exchange, e.message);
            throw KiteErrorTranslator.translate("Instrument fetch", e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching instruments for {}", exchange, e);
            throw new BrokerException("Error fetching instruments: " + e.getMessage(), e);
        }
    }
}
