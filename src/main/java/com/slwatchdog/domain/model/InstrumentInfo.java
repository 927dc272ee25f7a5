package com.slwatchdog.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InstrumentInfo {

    long instrumentToken;
    String tradingSymbol;
    String exchange;
    BigDecimal tickSize;
}
