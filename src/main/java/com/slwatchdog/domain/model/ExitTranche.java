package com.slwatchdog.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * One slice of a position's original size bound to a single exit condition.
 *
 * <p>The stop-loss tranche has no profit multiple; profit-target tranches fire once
 * price has moved {@code profitMultipleOfAtr} ATRs in the position's favour.
 * Instances are immutable; {@link #markTriggered()} returns a new instance and a
 * triggered tranche can never become untriggered again.
 */
@Value
public class ExitTranche {

    public static final String STOP_LOSS_ID = "stop_loss";

    String id;
    int percentOfOriginalPosition;
    BigDecimal profitMultipleOfAtr;
    boolean triggered;

    public ExitTranche(String id, int percentOfOriginalPosition, BigDecimal profitMultipleOfAtr, boolean triggered) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Tranche id is required");
        }
        if (percentOfOriginalPosition < 0 || percentOfOriginalPosition > 100) {
            throw new IllegalArgumentException(
                    "Tranche " + id + " percent out of range: " + percentOfOriginalPosition);
        }
        if (profitMultipleOfAtr != null && profitMultipleOfAtr.signum() <= 0) {
            throw new IllegalArgumentException("Tranche " + id + " profit multiple must be positive");
        }
        this.id = id;
        this.percentOfOriginalPosition = percentOfOriginalPosition;
        this.profitMultipleOfAtr = profitMultipleOfAtr;
        this.triggered = triggered;
    }

    public static ExitTranche stopLoss(int percent) {
        return new ExitTranche(STOP_LOSS_ID, percent, null, false);
    }

    public static ExitTranche profitTarget(String id, int percent, String atrMultiple) {
        return new ExitTranche(id, percent, new BigDecimal(atrMultiple), false);
    }

    public boolean isStopLoss() {
        return profitMultipleOfAtr == null;
    }

    public ExitTranche markTriggered() {
        return triggered ? this : new ExitTranche(id, percentOfOriginalPosition, profitMultipleOfAtr, true);
    }
}
