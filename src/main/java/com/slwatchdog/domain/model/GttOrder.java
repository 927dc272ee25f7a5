package com.slwatchdog.domain.model;

import lombok.Builder;
import lombok.Value;

/** Broker-side conditional (GTT) order summary. */
@Value
@Builder
public class GttOrder {

    int id;
    String tradingSymbol;
    String exchange;
    String status;

    public boolean isActive() {
        return "active".equalsIgnoreCase(status);
    }
}
