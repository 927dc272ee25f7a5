package com.slwatchdog.domain.model;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.PositionSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position tracked by the watchdog, keyed by trading symbol.
 *
 * <p>Instances are owned by {@link com.slwatchdog.ledger.PositionLedger}; every mutation
 * happens inside the ledger's per-ticker atomic section. Callers outside the ledger only
 * ever see copies produced by {@link #copy()}.
 *
 * <p>{@code exitTranches} stays empty until the first exit evaluation, when the tranche
 * preset for the ticker's volatility category is assigned for the rest of the
 * position's lifetime.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String ticker;
    private String exchange;
    private String product;
    private Long instrumentToken;
    private PositionSide side;

    /** Remaining quantity. Always positive while the position is in the ledger. */
    private int quantity;

    private int originalQuantity;
    private BigDecimal entryPrice;
    private BigDecimal investmentAmount;
    private PositionSource source;

    private boolean pendingOrder;
    private Instant pendingSince;
    private Instant lastFillAt;
    private Instant openedAt;

    @Builder.Default
    private Map<String, ExitTranche> exitTranches = new LinkedHashMap<>();

    public boolean hasPendingOrder() {
        return pendingOrder;
    }

    public boolean hasTranches() {
        return exitTranches != null && !exitTranches.isEmpty();
    }

    public void assignTranches(TranchePlan plan) {
        if (hasTranches()) {
            throw new IllegalStateException("Tranches already assigned for " + ticker);
        }
        this.exitTranches = new LinkedHashMap<>(plan.tranches());
    }

    /** Marks a tranche triggered. Returns false if it was already triggered or is unknown. */
    public boolean triggerTranche(String trancheId) {
        ExitTranche tranche = exitTranches.get(trancheId);
        if (tranche == null || tranche.isTriggered()) {
            return false;
        }
        exitTranches.put(trancheId, tranche.markTriggered());
        return true;
    }

    public int totalTranchePercent() {
        return exitTranches.values().stream()
                .mapToInt(ExitTranche::getPercentOfOriginalPosition)
                .sum();
    }

    /**
     * Checks the structural invariants: positive quantities, remaining never above
     * original, and tranche percentages summing to 100 once assigned.
     */
    public void validate() {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Position ticker is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("Position side is required for " + ticker);
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Position quantity must be positive for " + ticker + ": " + quantity);
        }
        if (originalQuantity < quantity) {
            throw new IllegalArgumentException(
                    "Original quantity " + originalQuantity + " below remaining " + quantity + " for " + ticker);
        }
        if (hasTranches() && totalTranchePercent() != 100) {
            throw new IllegalArgumentException("Tranches for " + ticker + " sum to " + totalTranchePercent());
        }
    }

    /** Deep enough copy for readers: the tranche map is duplicated, tranches themselves are immutable. */
    public Position copy() {
        return toBuilder().exitTranches(new LinkedHashMap<>(exitTranches)).build();
    }

    public String exchangeSymbol() {
        return exchange + ":" + ticker;
    }
}
