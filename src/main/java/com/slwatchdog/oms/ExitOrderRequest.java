package com.slwatchdog.oms;

import com.slwatchdog.domain.enums.ExitReason;
import com.slwatchdog.domain.enums.OrderSide;
import com.slwatchdog.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An exit order decided by the exit engine and queued for the {@link OrderExecutor}.
 *
 * <p>{@code side} is always the opposite of the position's direction. LIMIT requests
 * carry a tick-rounded {@code limitPrice}; MARKET requests leave it null.
 * {@code triggerPrice} is the market price that caused the decision and is kept
 * for the audit trail only.
 */
@Value
@Builder
public class ExitOrderRequest {

    String ticker;
    String exchange;

    @Builder.Default
    String product = "CNC";

    OrderSide side;
    OrderType orderType;
    int quantity;
    BigDecimal limitPrice;
    BigDecimal triggerPrice;
    ExitReason reason;
    String trancheId;
    int remainingQuantityAfterFill;
    Instant createdAt;

    /** Stable id so the audit log can correlate submission and outcome rows. */
    String correlationId;
}
