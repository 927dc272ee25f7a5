package com.slwatchdog.monitor;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.domain.model.StopLevel;
import com.slwatchdog.domain.model.VolatilityInfo;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.stop.TrailingStopTracker;
import com.slwatchdog.volatility.VolatilityService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Periodic table of tracked positions with last price, stop and unrealised P&amp;L. */
@Component
public class PortfolioSummaryLogger {

    private static final Logger log = LoggerFactory.getLogger(PortfolioSummaryLogger.class);

    private static final String ROW = "%-14s %-5s %7s %10s %10s %10s %12s %-6s%n";

    private final PositionLedger positionLedger;
    private final PositionMonitor positionMonitor;
    private final TrailingStopTracker trailingStopTracker;
    private final VolatilityService volatilityService;

    public PortfolioSummaryLogger(
            PositionLedger positionLedger,
            PositionMonitor positionMonitor,
            TrailingStopTracker trailingStopTracker,
            VolatilityService volatilityService) {
        this.positionLedger = positionLedger;
        this.positionMonitor = positionMonitor;
        this.trailingStopTracker = trailingStopTracker;
        this.volatilityService = volatilityService;
    }

    public String render() {
        List<Position> positions = positionLedger.snapshot();
        StringBuilder table = new StringBuilder();
        table.append(String.format(ROW, "TICKER", "SIDE", "QTY", "ENTRY", "LAST", "STOP", "P&L", "VOL"));
        BigDecimal total = BigDecimal.ZERO;
        for (Position position : positions) {
            String ticker = position.getTicker();
            BigDecimal last = positionMonitor.lastPrice(ticker).orElse(null);
            BigDecimal stop = trailingStopTracker.current(ticker).map(StopLevel::getStopPrice).orElse(null);
            String category = volatilityService.get(ticker).map(VolatilityInfo::getCategory).map(Enum::name).orElse("-");
            BigDecimal pnl = unrealisedPnl(position, last);
            if (pnl != null) {
                total = total.add(pnl);
            }
            table.append(String.format(
                    ROW,
                    ticker,
                    position.getSide(),
                    position.getQuantity(),
                    format(position.getEntryPrice()),
                    format(last),
                    format(stop),
                    format(pnl),
                    category));
        }
        table.append(String.format("positions=%d, unrealisedPnl=%s", positions.size(), format(total)));
        return table.toString();
    }

    public void logSummary() {
        if (positionLedger.isEmpty()) {
            log.info("Portfolio summary: no tracked positions");
            return;
        }
        log.info("Portfolio summary:\n{}", render());
    }

    static BigDecimal unrealisedPnl(Position position, BigDecimal last) {
        if (last == null || position.getEntryPrice() == null) {
            return null;
        }
        BigDecimal perShare = last.subtract(position.getEntryPrice());
        if (position.getSide() == PositionSide.SHORT) {
            perShare = perShare.negate();
        }
        return perShare.multiply(BigDecimal.valueOf(position.getQuantity())).setScale(2, RoundingMode.HALF_UP);
    }

    private static String format(BigDecimal value) {
        return value == null ? "-" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
