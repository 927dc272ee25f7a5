package com.slwatchdog.instrument;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.domain.model.InstrumentInfo;
import com.slwatchdog.exception.BaseException;
import com.slwatchdog.exception.InstrumentNotFoundException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves trading symbols to Kite instrument tokens and tick sizes.
 *
 * <p>The instrument dump for an exchange is downloaded once and cached for the process
 * lifetime (the watchdog runs for a single session). Token lookups download on a miss;
 * {@link #findTickSize} only reads the cache, since it runs inside the ledger's
 * per-ticker atomic section. {@link #preload} fills the cache before the feed starts. A
 * failed download is not cached.
 */
@Service
public class InstrumentService {

    private static final Logger log = LoggerFactory.getLogger(InstrumentService.class);

    private final BrokerGateway brokerGateway;

    /** exchange -> (tradingSymbol -> instrument) */
    private final Map<String, Map<String, InstrumentInfo>> cache = new ConcurrentHashMap<>();

    public InstrumentService(BrokerGateway brokerGateway) {
        this.brokerGateway = brokerGateway;
    }

    /**
     * Returns the instrument token for a symbol.
     *
     * @throws InstrumentNotFoundException if the exchange has no such symbol
     */
    public long resolveToken(String exchange, String tradingSymbol) {
        return find(exchange, tradingSymbol)
                .map(InstrumentInfo::getInstrumentToken)
                .orElseThrow(() -> new InstrumentNotFoundException(exchange, tradingSymbol));
    }

    /** Tick size from the cached dump; empty if the exchange is not loaded or the symbol unknown. */
    public Optional<BigDecimal> findTickSize(String exchange, String tradingSymbol) {
        return Optional.ofNullable(cache.get(exchange))
                .map(instruments -> instruments.get(tradingSymbol))
                .map(InstrumentInfo::getTickSize)
                .filter(tick -> tick.signum() > 0);
    }

    /**
     * Downloads the dumps for the given exchanges ahead of use. A failure is logged and
     * leaves that exchange unloaded; tick sizes then fall back to price bands.
     */
    public void preload(Collection<String> exchanges) {
        for (String exchange : new LinkedHashSet<>(exchanges)) {
            if (exchange == null) {
                continue;
            }
            try {
                instrumentsFor(exchange);
            } catch (BaseException e) {
                log.warn("Instrument preload failed for {}: {}", exchange, e.getMessage());
            }
        }
    }

    public Optional<InstrumentInfo> find(String exchange, String tradingSymbol) {
        return Optional.ofNullable(instrumentsFor(exchange).get(tradingSymbol));
    }

    private Map<String, InstrumentInfo> instrumentsFor(String exchange) {
        return cache.computeIfAbsent(exchange, this::download);
    }

    private Map<String, InstrumentInfo> download(String exchange) {
        List<InstrumentInfo> instruments = brokerGateway.getInstruments(exchange);
        log.info("Loaded {} instruments for {}", instruments.size(), exchange);
        return instruments.stream()
                .collect(Collectors.toMap(InstrumentInfo::getTradingSymbol, Function.identity(), (a, b) -> a));
    }
}
