package com.slwatchdog.reconciliation;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.model.GttOrder;
import com.slwatchdog.exception.BaseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cancels active GTT orders left behind for a symbol the watchdog no longer holds,
 * so a stale broker-side trigger cannot open a fresh position after the exit.
 */
@Service
public class GttCleanupService {

    private static final Logger log = LoggerFactory.getLogger(GttCleanupService.class);

    private final BrokerGateway brokerGateway;
    private final WatchdogProperties watchdogProperties;

    public GttCleanupService(BrokerGateway brokerGateway, WatchdogProperties watchdogProperties) {
        this.brokerGateway = brokerGateway;
        this.watchdogProperties = watchdogProperties;
    }

    /**
     * Cancels the symbol's active GTTs. Failures are logged per GTT.
     *
     * @return number of GTTs cancelled
     */
    public int cancelActiveGtts(String ticker, String exchange) {
        if (!watchdogProperties.isCancelGttOnExit()) {
            return 0;
        }
        List<GttOrder> gtts;
        try {
            gtts = brokerGateway.getGttOrders();
        } catch (BaseException e) {
            log.warn("Could not list GTT orders for cleanup: ticker={}, reason={}", ticker, e.getMessage());
            return 0;
        }
        int cancelled = 0;
        for (GttOrder gtt : gtts) {
            if (!gtt.isActive() || !ticker.equalsIgnoreCase(gtt.getTradingSymbol())) {
                continue;
            }
            if (exchange != null && gtt.getExchange() != null && !exchange.equalsIgnoreCase(gtt.getExchange())) {
                continue;
            }
            try {
                brokerGateway.cancelGttOrder(gtt.getId());
                cancelled++;
                log.info("Cancelled GTT after exit: ticker={}, gttId={}", ticker, gtt.getId());
            } catch (BaseException e) {
                log.warn("GTT cancellation failed: ticker={}, gttId={}, reason={}", ticker, gtt.getId(), e.getMessage());
            }
        }
        return cancelled;
    }
}
