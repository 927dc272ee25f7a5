package com.slwatchdog.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Value;

/** Immutable last-traded price for one ticker, emitted by the price feed. */
@Value
public class PriceObservation {

    String ticker;
    BigDecimal price;
    Instant observedAt;
}
