package com.slwatchdog.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** One daily OHLC bar from the broker's historical data endpoint. */
@Value
@Builder
public class DailyCandle {

    LocalDate date;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
}
