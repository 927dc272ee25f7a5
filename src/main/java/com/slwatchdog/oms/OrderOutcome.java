package com.slwatchdog.oms;

import com.slwatchdog.domain.enums.OrderOutcomeStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable result of executing one {@link ExitOrderRequest}. Applied to the ledger
 * by {@link com.slwatchdog.ledger.PositionLedger#applyOutcome(OrderOutcome)}.
 */
@Value
@Builder
public class OrderOutcome {

    ExitOrderRequest request;
    OrderOutcomeStatus status;
    String brokerOrderId;

    /** Best-known filled quantity; the requested quantity for accepted orders, zero on failure. */
    int filledQuantity;

    int attempts;
    String errorMessage;
    Instant completedAt;

    public String getTicker() {
        return request.getTicker();
    }

    public String getTrancheId() {
        return request.getTrancheId();
    }
}
