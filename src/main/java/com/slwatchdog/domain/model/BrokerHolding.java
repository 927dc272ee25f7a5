package com.slwatchdog.domain.model;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.PositionSource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A position or demat holding as reported by the broker. Quantity is unsigned;
 * {@code side} carries the direction.
 */
@Data
@Builder
public class BrokerHolding {

    private String tradingSymbol;
    private String exchange;
    private String product;
    private Long instrumentToken;
    private PositionSide side;
    private int quantity;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private PositionSource source;
}
