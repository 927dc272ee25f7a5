package com.slwatchdog.broker;

import com.slwatchdog.broker.mapper.KitePositionMapper;
import com.slwatchdog.domain.model.BrokerHolding;
import com.slwatchdog.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Holding;
import com.zerodhatech.models.Position;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Internal service that fetches positions and holdings from the Kite Connect API.
 *
 * <p>Kite returns positions as a {@code Map<String, List<Position>>} with "day" and
 * "net" keys; the watchdog only looks at "net". Holdings cover delivery shares carried
 * from earlier sessions, including T1 quantity not yet settled.
 */
@Service
public class KitePositionService {

    private static final Logger log = LoggerFactory.getLogger(KitePositionService.class);

    private final KiteConnect kiteConnect;
    private final KitePositionMapper kitePositionMapper;

    public KitePositionService(KiteConnect kiteConnect, KitePositionMapper kitePositionMapper) {
        this.kiteConnect = kiteConnect;
        this.kitePositionMapper = kitePositionMapper;
    }

    /**
     * Fetches net CNC positions and holdings and merges them.
     *
     * @throws BrokerException if either API call fails
     */
    @RateLimiter(name = "kiteQuotes")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<BrokerHolding> getOpenPositions() {
        try {
            Map<String, List<Position>> positions = kiteConnect.getPositions();
            List<Position> net = positions != null ? positions.getOrDefault("net", List.of()) : List.of();
            List<Holding> holdings = kiteConnect.getHoldings();
            List<BrokerHolding> merged = kitePositionMapper.merge(net, holdings);
            log.debug(
                    "Fetched broker positions: net={}, holdings={}, merged={}",
                    net.size(),
                    holdings != null ? holdings.size() : 0,
                    merged.size());
            return merged;
        } catch (KiteException e) {
            log.error("Failed to fetch positions: {}", e.message);
            throw KiteErrorTranslator.translate("Position fetch", e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching positions", e);
            throw new BrokerException("Error fetching positions: " + e.getMessage(), e);
        }
    }
}
