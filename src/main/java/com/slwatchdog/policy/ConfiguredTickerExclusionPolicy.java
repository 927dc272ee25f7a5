package com.slwatchdog.policy;

import com.slwatchdog.config.WatchdogProperties;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Exclusions from {@code watchdog.excluded-tickers}, matched case-insensitively. */
@Component
public class ConfiguredTickerExclusionPolicy implements TickerExclusionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredTickerExclusionPolicy.class);

    private final Set<String> excluded;

    public ConfiguredTickerExclusionPolicy(WatchdogProperties watchdogProperties) {
        this.excluded = watchdogProperties.getExcludedTickers().stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (!excluded.isEmpty()) {
            log.info("Excluded tickers: {}", excluded);
        }
    }

    @Override
    public boolean isExcluded(String ticker) {
        return ticker != null && excluded.contains(ticker.toUpperCase(Locale.ROOT));
    }
}
