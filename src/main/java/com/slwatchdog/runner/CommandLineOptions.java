package com.slwatchdog.runner;

import com.slwatchdog.config.WatchdogProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;

/**
 * The watchdog's command line:
 * <pre>
 *   --tickers=INFY,TCS        track only these tickers
 *   --watchlist=file.txt      ticker file, one per line ({@code #} comments allowed)
 *   --orders-file=orders.json orders file (also accepted as the first plain argument)
 *   --poll-interval=10        seconds between price polls
 *   --verbose                 DEBUG logging for com.slwatchdog
 * </pre>
 * Every other {@code --key=value} is left to Spring's property binding.
 */
@Value
@Builder
public class CommandLineOptions {

    static final String TICKERS = "tickers";
    static final String WATCHLIST = "watchlist";
    static final String ORDERS_FILE = "orders-file";
    static final String POLL_INTERVAL = "poll-interval";
    static final String VERBOSE = "verbose";

    @Builder.Default
    List<String> tickers = List.of();

    String watchlist;
    String ordersFile;
    Duration pollInterval;
    boolean verbose;

    public static CommandLineOptions parse(ApplicationArguments args) {
        CommandLineOptionsBuilder builder = CommandLineOptions.builder();

        List<String> tickers = new ArrayList<>();
        for (String value : values(args, TICKERS)) {
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> s.toUpperCase(Locale.ROOT))
                    .forEach(tickers::add);
        }
        builder.tickers(List.copyOf(tickers));

        builder.watchlist(last(args, WATCHLIST));

        String ordersFile = last(args, ORDERS_FILE);
        if (ordersFile == null && !args.getNonOptionArgs().isEmpty()) {
            ordersFile = args.getNonOptionArgs().get(0);
        }
        builder.ordersFile(ordersFile);

        String poll = last(args, POLL_INTERVAL);
        if (poll != null) {
            builder.pollInterval(parsePollInterval(poll));
        }

        builder.verbose(args.containsOption(VERBOSE));
        return builder.build();
    }

    static Duration parsePollInterval(String value) {
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--poll-interval must be a whole number of seconds: " + value, e);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("--poll-interval must be positive: " + value);
        }
        return Duration.ofSeconds(seconds);
    }

    /** Writes the options that have a property counterpart onto {@code properties}. */
    public void applyTo(WatchdogProperties properties) {
        if (!tickers.isEmpty()) {
            properties.setTickers(new ArrayList<>(tickers));
        }
        if (watchlist != null) {
            properties.setWatchlist(watchlist);
        }
        if (ordersFile != null) {
            properties.setOrdersFile(ordersFile);
        }
        if (pollInterval != null) {
            properties.setPollInterval(pollInterval);
        }
    }

    private static List<String> values(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values != null ? values : List.of();
    }

    private static String last(ApplicationArguments args, String name) {
        List<String> values = values(args, name);
        if (values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
