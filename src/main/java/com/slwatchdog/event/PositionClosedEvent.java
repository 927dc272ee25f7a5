package com.slwatchdog.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a ticker leaves the {@link com.slwatchdog.ledger.PositionLedger}.
 *
 * <p>Listeners drop per-ticker state (trailing stop, watermark, volatility reading) and,
 * when configured, cancel the symbol's remaining GTT orders at the broker.
 */
public class PositionClosedEvent extends ApplicationEvent {

    private final String ticker;
    private final String exchange;
    private final CloseCause cause;

    public PositionClosedEvent(Object source, String ticker, String exchange, CloseCause cause) {
        super(source);
        this.ticker = ticker;
        this.exchange = exchange;
        this.cause = cause;
    }

    public String getTicker() {
        return ticker;
    }

    public String getExchange() {
        return exchange;
    }

    public CloseCause getCause() {
        return cause;
    }

    public enum CloseCause {
        /** The watchdog's own exit orders brought the quantity to zero. */
        EXIT_FILLED,
        /** The broker stopped reporting the position (sold elsewhere, or settled). */
        GONE_AT_BROKER
    }
}
