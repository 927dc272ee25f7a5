package com.slwatchdog.runner;

import com.slwatchdog.exception.WatchdogStartupException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads a ticker watchlist: one symbol per line, blank lines and {@code #} comments ignored. */
@Component
public class WatchlistLoader {

    private static final Logger log = LoggerFactory.getLogger(WatchlistLoader.class);

    public List<String> load(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WatchdogStartupException("Cannot read watchlist " + file, e);
        }
        Set<String> tickers = new LinkedHashSet<>();
        for (String line : lines) {
            int comment = line.indexOf('#');
            String ticker = (comment >= 0 ? line.substring(0, comment) : line).trim();
            if (!ticker.isEmpty()) {
                tickers.add(ticker.toUpperCase(Locale.ROOT));
            }
        }
        log.info("Watchlist loaded: file={}, tickers={}", file, tickers.size());
        return new ArrayList<>(tickers);
    }
}
