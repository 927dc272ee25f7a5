package com.slwatchdog.domain.model;

import com.slwatchdog.domain.enums.VolatilityCategory;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** ATR reading for one ticker, computed from daily bars. */
@Value
@Builder
public class VolatilityInfo {

    String ticker;
    BigDecimal atrValue;
    BigDecimal atrPercent;
    VolatilityCategory category;
    BigDecimal stopMultiplier;

    /** High and low of the most recent daily bar; seeds the trailing extreme. */
    BigDecimal dailyHigh;

    BigDecimal dailyLow;
    BigDecimal latestClose;
    Instant computedAt;

    /** ATR scaled by the category multiplier: the distance between extreme and stop. */
    public BigDecimal stopDistance() {
        return atrValue.multiply(stopMultiplier);
    }
}
