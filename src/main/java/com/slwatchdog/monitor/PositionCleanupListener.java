package com.slwatchdog.monitor;

import com.slwatchdog.event.PositionClosedEvent;
import com.slwatchdog.reconciliation.GttCleanupService;
import com.slwatchdog.stop.TrailingStopTracker;
import com.slwatchdog.volatility.VolatilityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Drops per-ticker state once a position leaves the ledger. */
@Component
public class PositionCleanupListener {

    private static final Logger log = LoggerFactory.getLogger(PositionCleanupListener.class);

    private final TrailingStopTracker trailingStopTracker;
    private final VolatilityService volatilityService;
    private final PositionMonitor positionMonitor;
    private final GttCleanupService gttCleanupService;

    public PositionCleanupListener(
            TrailingStopTracker trailingStopTracker,
            VolatilityService volatilityService,
            PositionMonitor positionMonitor,
            GttCleanupService gttCleanupService) {
        this.trailingStopTracker = trailingStopTracker;
        this.volatilityService = volatilityService;
        this.positionMonitor = positionMonitor;
        this.gttCleanupService = gttCleanupService;
    }

    @EventListener
    public void onPositionClosed(PositionClosedEvent event) {
        String ticker = event.getTicker();
        trailingStopTracker.onPositionClosed(ticker);
        volatilityService.forget(ticker);
        positionMonitor.forget(ticker);
        int cancelled = gttCleanupService.cancelActiveGtts(ticker, event.getExchange());
        log.info("Position state cleared: ticker={}, cause={}, gttsCancelled={}", ticker, event.getCause(), cancelled);
    }
}
