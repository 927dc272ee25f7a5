package com.slwatchdog.domain.model;

import com.slwatchdog.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Value;

/**
 * Trailing-stop state of one ticker: the best price seen in the position's favour
 * (high for LONG, low for SHORT) and the stop derived from it.
 */
@Value
public class StopLevel {

    String ticker;
    PositionSide side;
    BigDecimal extreme;
    BigDecimal stopPrice;
    Instant updatedAt;

    /** True when {@code price} has crossed the stop unfavourably. */
    public boolean isBreachedBy(BigDecimal price) {
        if (stopPrice == null) {
            return false;
        }
        return side == PositionSide.LONG ? price.compareTo(stopPrice) <= 0 : price.compareTo(stopPrice) >= 0;
    }
}
