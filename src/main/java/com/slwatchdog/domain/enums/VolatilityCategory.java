package com.slwatchdog.domain.enums;

import java.math.BigDecimal;

/**
 * Volatility bucket derived from ATR as a percentage of the latest close.
 *
 * <pre>
 * atr% &lt; 2        LOW     stop distance 1.0 x ATR
 * 2 &lt;= atr% &lt;= 4  MEDIUM  stop distance 1.5 x ATR
 * atr% &gt; 4        HIGH    stop distance 2.0 x ATR
 * </pre>
 */
public enum VolatilityCategory {
    LOW(new BigDecimal("1.0")),
    MEDIUM(new BigDecimal("1.5")),
    HIGH(new BigDecimal("2.0"));

    private static final BigDecimal LOW_UPPER = new BigDecimal("2");
    private static final BigDecimal MEDIUM_UPPER = new BigDecimal("4");

    private final BigDecimal stopMultiplier;

    VolatilityCategory(BigDecimal stopMultiplier) {
        this.stopMultiplier = stopMultiplier;
    }

    public BigDecimal getStopMultiplier() {
        return stopMultiplier;
    }

    public static VolatilityCategory classify(BigDecimal atrPercent) {
        if (atrPercent.compareTo(LOW_UPPER) < 0) {
            return LOW;
        }
        if (atrPercent.compareTo(MEDIUM_UPPER) <= 0) {
            return MEDIUM;
        }
        return HIGH;
    }
}
