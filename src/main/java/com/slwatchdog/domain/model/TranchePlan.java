package com.slwatchdog.domain.model;

import com.slwatchdog.domain.enums.VolatilityCategory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated set of exit tranches for one position. Percentages always sum to 100.
 *
 * <p>Presets per volatility category:
 * <pre>
 * LOW     stop 50%   target 30% at 2.0 ATR   target 20% at 3.0 ATR
 * MEDIUM  stop 40%   target 30% at 2.5 ATR   target 30% at 4.0 ATR
 * HIGH    stop 30%   target 30% at 3.0 ATR   target 40% at 5.0 ATR
 * </pre>
 */
public final class TranchePlan {

    private final Map<String, ExitTranche> tranches;

    private TranchePlan(List<ExitTranche> tranches) {
        Map<String, ExitTranche> byId = new LinkedHashMap<>();
        int total = 0;
        for (ExitTranche tranche : tranches) {
            if (byId.put(tranche.getId(), tranche) != null) {
                throw new IllegalArgumentException("Duplicate tranche id: " + tranche.getId());
            }
            total += tranche.getPercentOfOriginalPosition();
        }
        if (total != 100) {
            throw new IllegalArgumentException("Tranche percentages must sum to 100 but were " + total);
        }
        long stopLossCount = byId.values().stream().filter(ExitTranche::isStopLoss).count();
        if (stopLossCount != 1) {
            throw new IllegalArgumentException("Exactly one stop-loss tranche is required, found " + stopLossCount);
        }
        this.tranches = Collections.unmodifiableMap(byId);
    }

    public static TranchePlan of(List<ExitTranche> tranches) {
        return new TranchePlan(tranches);
    }

    public static TranchePlan forCategory(VolatilityCategory category) {
        return switch (category) {
            case LOW -> of(List.of(
                    ExitTranche.stopLoss(50),
                    ExitTranche.profitTarget("profit_target_1", 30, "2.0"),
                    ExitTranche.profitTarget("profit_target_2", 20, "3.0")));
            case MEDIUM -> of(List.of(
                    ExitTranche.stopLoss(40),
                    ExitTranche.profitTarget("profit_target_1", 30, "2.5"),
                    ExitTranche.profitTarget("profit_target_2", 30, "4.0")));
            case HIGH -> of(List.of(
                    ExitTranche.stopLoss(30),
                    ExitTranche.profitTarget("profit_target_1", 30, "3.0"),
                    ExitTranche.profitTarget("profit_target_2", 40, "5.0")));
        };
    }

    /** Insertion-ordered, unmodifiable view keyed by tranche id. */
    public Map<String, ExitTranche> tranches() {
        return tranches;
    }
}
