package com.slwatchdog.runner;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.calendar.TradingCalendarService;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.exception.WatchdogStartupException;
import com.slwatchdog.feed.PriceFeed;
import com.slwatchdog.instrument.InstrumentService;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.lifecycle.ShutdownSignal;
import com.slwatchdog.monitor.PortfolioSummaryLogger;
import com.slwatchdog.oms.OrderExecutor;
import com.slwatchdog.policy.TickerExclusionPolicy;
import com.slwatchdog.reconciliation.PositionReconciliationService;
import com.slwatchdog.reconciliation.ReconciliationResult;
import com.slwatchdog.volatility.VolatilityService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Startup sequence and control loop of the watchdog.
 *
 * <ol>
 *   <li>Apply command-line options; verify the broker session (fatal on failure).</li>
 *   <li>Reconcile with the broker, add orders-file positions, fail if nothing is tracked.</li>
 *   <li>Load instrument dumps, compute volatility for every position, start the order
 *       executor and price feed.</li>
 *   <li>Control loop: reconcile and refresh volatility every reconcile interval, log the
 *       portfolio every summary interval, stop at market close or on shutdown.</li>
 *   <li>Stop and join the feed and executor, each bounded by the shutdown timeout.</li>
 * </ol>
 */
@Component
public class WatchdogRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(WatchdogRunner.class);

    private static final String BASE_LOGGER = "com.slwatchdog";
    private static final Duration MAX_CONTROL_WAIT = Duration.ofSeconds(30);

    private final WatchdogProperties watchdogProperties;
    private final BrokerGateway brokerGateway;
    private final PositionLedger positionLedger;
    private final PositionReconciliationService positionReconciliationService;
    private final VolatilityService volatilityService;
    private final InstrumentService instrumentService;
    private final OrderExecutor orderExecutor;
    private final PriceFeed priceFeed;
    private final PortfolioSummaryLogger portfolioSummaryLogger;
    private final TradingCalendarService tradingCalendarService;
    private final TickerExclusionPolicy tickerExclusionPolicy;
    private final OrdersFileLoader ordersFileLoader;
    private final WatchlistLoader watchlistLoader;
    private final ShutdownSignal shutdownSignal;
    private final LoggingSystem loggingSystem;
    private final Clock clock;

    public WatchdogRunner(
            WatchdogProperties watchdogProperties,
            BrokerGateway brokerGateway,
            PositionLedger positionLedger,
            PositionReconciliationService positionReconciliationService,
            VolatilityService volatilityService,
            InstrumentService instrumentService,
            OrderExecutor orderExecutor,
            PriceFeed priceFeed,
            PortfolioSummaryLogger portfolioSummaryLogger,
            TradingCalendarService tradingCalendarService,
            TickerExclusionPolicy tickerExclusionPolicy,
            OrdersFileLoader ordersFileLoader,
            WatchlistLoader watchlistLoader,
            ShutdownSignal shutdownSignal,
            LoggingSystem loggingSystem,
            Clock clock) {
        this.watchdogProperties = watchdogProperties;
        this.brokerGateway = brokerGateway;
        this.positionLedger = positionLedger;
        this.positionReconciliationService = positionReconciliationService;
        this.volatilityService = volatilityService;
        this.instrumentService = instrumentService;
        this.orderExecutor = orderExecutor;
        this.priceFeed = priceFeed;
        this.portfolioSummaryLogger = portfolioSummaryLogger;
        this.tradingCalendarService = tradingCalendarService;
        this.tickerExclusionPolicy = tickerExclusionPolicy;
        this.ordersFileLoader = ordersFileLoader;
        this.watchlistLoader = watchlistLoader;
        this.shutdownSignal = shutdownSignal;
        this.loggingSystem = loggingSystem;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        CommandLineOptions options = CommandLineOptions.parse(args);
        if (options.isVerbose()) {
            loggingSystem.setLogLevel(BASE_LOGGER, LogLevel.DEBUG);
        }
        options.applyTo(watchdogProperties);
        mergeWatchlist();

        String user = brokerGateway.verifySession();
        log.info("Broker session verified: user={}", user);

        if (watchdogProperties.isAutoShutdownAtClose() && tradingCalendarService.isSessionOver()) {
            log.info("Market session is over for today ({}), nothing to watch", tradingCalendarService.now().toLocalDate());
            return;
        }

        startup();
        try {
            controlLoop();
        } finally {
            shutdown();
        }
    }

    void startup() {
        ReconciliationResult result = positionReconciliationService.reconcile(PositionReconciliationService.TRIGGER_STARTUP);
        log.info("Broker positions tracked at startup: {}", result.getAdded().size());

        String ordersFile = watchdogProperties.getOrdersFile();
        if (ordersFile != null && !ordersFile.isBlank()) {
            loadOrdersFile(Path.of(ordersFile));
        }

        if (positionLedger.isEmpty()) {
            throw new WatchdogStartupException("No positions to track: broker reported none"
                    + (watchdogProperties.getTickers().isEmpty() ? "" : " matching " + watchdogProperties.getTickers()));
        }

        List<Position> positions = positionLedger.snapshot();
        instrumentService.preload(positions.stream().map(Position::getExchange).toList());
        volatilityService.refreshAll(positions);
        for (Position position : positions) {
            log.info(
                    "Watching: ticker={}, side={}, qty={}, entry={}, source={}, volatility={}",
                    position.getTicker(),
                    position.getSide(),
                    position.getQuantity(),
                    position.getEntryPrice(),
                    position.getSource(),
                    volatilityService.get(position.getTicker()).map(v -> v.getCategory().name()).orElse("pending"));
        }

        orderExecutor.start();
        priceFeed.start();
        log.info(
                "Watchdog running: positions={}, pollInterval={}s, reconcileInterval={}m",
                positionLedger.size(),
                watchdogProperties.getPollInterval().toSeconds(),
                watchdogProperties.getReconcileInterval().toMinutes());
    }

    void controlLoop() {
        Instant nextReconcile = clock.instant().plus(watchdogProperties.getReconcileInterval());
        Instant nextSummary = clock.instant().plus(watchdogProperties.getSummaryInterval());

        while (!shutdownSignal.isCancelled()) {
            if (watchdogProperties.isAutoShutdownAtClose() && tradingCalendarService.isSessionOver()) {
                log.info("Market closed, stopping watchdog");
                shutdownSignal.cancel();
                break;
            }

            Instant now = clock.instant();
            if (!now.isBefore(nextReconcile)) {
                scheduledReconcile();
                nextReconcile = now.plus(watchdogProperties.getReconcileInterval());
            }
            if (!now.isBefore(nextSummary)) {
                portfolioSummaryLogger.logSummary();
                nextSummary = now.plus(watchdogProperties.getSummaryInterval());
            }

            Instant wake = nextReconcile.isBefore(nextSummary) ? nextReconcile : nextSummary;
            Duration wait = Duration.between(clock.instant(), wake);
            if (wait.compareTo(MAX_CONTROL_WAIT) > 0) {
                wait = MAX_CONTROL_WAIT;
            }
            if (wait.isNegative() || wait.isZero()) {
                continue;
            }
            if (!shutdownSignal.sleep(wait)) {
                break;
            }
        }
    }

    void scheduledReconcile() {
        try {
            positionReconciliationService.reconcile(PositionReconciliationService.TRIGGER_SCHEDULED);
        } catch (RuntimeException e) {
            log.warn("Scheduled reconciliation failed, keeping current positions: {}", e.getMessage());
        }
        volatilityService.refreshAll(positionLedger.snapshot());
    }

    void shutdown() {
        shutdownSignal.cancel();
        priceFeed.stop();
        orderExecutor.stop();
        portfolioSummaryLogger.logSummary();
        log.info("Watchdog stopped: positionsStillTracked={}", positionLedger.size());
    }

    private void loadOrdersFile(Path file) {
        int added = 0;
        for (Position position : ordersFileLoader.load(
                file, watchdogProperties.getDefaultExchange(), watchdogProperties.getDefaultProduct())) {
            String ticker = position.getTicker();
            if (tickerExclusionPolicy.isExcluded(ticker) || !isAllowed(ticker)) {
                continue;
            }
            if (positionLedger.putIfAbsent(position)) {
                added++;
                log.info(
                        "Tracking orders-file position: ticker={}, qty={}, entry={}",
                        ticker,
                        position.getQuantity(),
                        position.getEntryPrice());
            }
        }
        log.info("Orders file positions added: {}", added);
    }

    private boolean isAllowed(String ticker) {
        List<String> tickers = watchdogProperties.getTickers();
        return tickers.isEmpty() || tickers.contains(ticker.toUpperCase(Locale.ROOT));
    }

    private void mergeWatchlist() {
        String watchlist = watchdogProperties.getWatchlist();
        if (watchlist == null || watchlist.isBlank()) {
            return;
        }
        Set<String> merged = new LinkedHashSet<>(watchdogProperties.getTickers());
        merged.addAll(watchlistLoader.load(Path.of(watchlist)));
        watchdogProperties.setTickers(List.copyOf(merged));
        log.info("Ticker filter active: {} tickers", merged.size());
    }
}
