package com.slwatchdog.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Runtime settings of the watchdog, bound from the {@code watchdog.*} prefix.
 *
 * <p>Command-line options ({@code --poll-interval}, {@code --tickers}, ...) override
 * the matching values here; see {@link com.slwatchdog.runner.CommandLineOptions}.
 */
@Configuration
@ConfigurationProperties(prefix = "watchdog")
@Getter
@Setter
public class WatchdogProperties {

    /** Interval between LTP polls. */
    private Duration pollInterval = Duration.ofSeconds(5);

    /** Interval between broker reconciliations. */
    private Duration reconcileInterval = Duration.ofMinutes(10);

    /** Minimum age of a volatility reading before it is recomputed. */
    private Duration volatilityRefresh = Duration.ofHours(24);

    /** How long a just-filled or just-closed ticker is shielded from reconciliation. */
    private Duration graceWindow = Duration.ofMinutes(5);

    /** Bounded join timeout for the feed and executor threads on shutdown. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /** Interval between portfolio summary log blocks. */
    private Duration summaryInterval = Duration.ofMinutes(10);

    /** Calendar days of daily candles requested for the ATR computation. */
    private int historyDays = 60;

    private int atrPeriod = 20;

    /** Limit price offset through the stop, in percent. */
    private BigDecimal stopLimitOffsetPct = new BigDecimal("0.5");

    private String defaultExchange = "NSE";

    private String defaultProduct = "CNC";

    /** Symbols per batched LTP call. */
    private int quoteBatchSize = 500;

    /** Stop at 15:30 IST and on exchange holidays. */
    private boolean autoShutdownAtClose = true;

    /** Cancel active GTT orders for a symbol once its position is fully exited. */
    private boolean cancelGttOnExit = true;

    /** If non-empty, only these tickers are tracked. */
    private List<String> tickers = new ArrayList<>();

    /** Optional file with one ticker per line, merged into {@link #tickers}. */
    private String watchlist;

    /** Optional JSON orders file supplementing broker positions. */
    private String ordersFile;

    /** Tickers never tracked or traded by the watchdog. */
    private List<String> excludedTickers = new ArrayList<>();

    /** Exchange tick sizes that differ from the instrument dump or price bands. */
    private Map<String, BigDecimal> tickSizeOverrides = new HashMap<>();

    private RetrySettings retry = new RetrySettings();

    @Getter
    @Setter
    public static class RetrySettings {

        private int maxAttempts = 5;

        private double multiplier = 1.5;

        private Duration rateLimitedBaseDelay = Duration.ofSeconds(2);

        private Duration transientBaseDelay = Duration.ofSeconds(1);
    }
}
