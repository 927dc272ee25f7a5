package com.slwatchdog.reconciliation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of aligning the ledger with the broker's position list.
 *
 * <p>{@code retained} lists tickers the broker no longer reports but that were kept
 * because an exit order is in flight or a fill is still settling.
 */
@Data
@Builder
public class ReconciliationResult {

    private Instant timestamp;
    private String trigger;

    private int brokerPositionCount;
    private int localPositionCount;

    @Builder.Default
    private List<String> added = new ArrayList<>();

    @Builder.Default
    private List<String> removed = new ArrayList<>();

    @Builder.Default
    private List<String> retained = new ArrayList<>();

    @Builder.Default
    private List<String> quantityUpdated = new ArrayList<>();

    @Builder.Default
    private List<String> excluded = new ArrayList<>();

    private long durationMs;

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !quantityUpdated.isEmpty();
    }
}
