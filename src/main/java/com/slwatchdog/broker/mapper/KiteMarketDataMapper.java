package com.slwatchdog.broker.mapper;

import com.slwatchdog.domain.model.DailyCandle;
import com.slwatchdog.domain.model.InstrumentInfo;
import com.zerodhatech.models.HistoricalData;
import com.zerodhatech.models.Instrument;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts Kite historical candles and instrument dump rows to domain types.
 *
 * <p>Kite candle timestamps look like {@code 2025-06-11T00:00:00+0530}; for daily
 * candles only the date part matters.
 */
@Slf4j
@Component
public class KiteMarketDataMapper {

    public List<DailyCandle> toDailyCandles(HistoricalData historicalData) {
        if (historicalData == null || historicalData.dataArrayList == null) {
            return List.of();
        }
        List<DailyCandle> candles = new ArrayList<>();
        for (HistoricalData row : historicalData.dataArrayList) {
            LocalDate date = parseDate(row.timeStamp);
            if (date == null) {
                log.debug("Skipping candle with unparseable timestamp: {}", row.timeStamp);
                continue;
            }
            candles.add(DailyCandle.builder()
                    .date(date)
                    .open(BigDecimal.valueOf(row.open))
                    .high(BigDecimal.valueOf(row.high))
                    .low(BigDecimal.valueOf(row.low))
                    .close(BigDecimal.valueOf(row.close))
                    .volume(row.volume)
                    .build());
        }
        candles.sort(Comparator.comparing(DailyCandle::getDate));
        return candles;
    }

    public InstrumentInfo toInstrumentInfo(Instrument instrument) {
        return InstrumentInfo.builder()
                .instrumentToken(instrument.instrument_token)
                .tradingSymbol(instrument.tradingsymbol)
                .exchange(instrument.exchange)
                .tickSize(BigDecimal.valueOf(instrument.tick_size))
                .build();
    }

    public List<InstrumentInfo> toInstrumentInfos(List<Instrument> instruments) {
        if (instruments == null) {
            return List.of();
        }
        return instruments.stream().map(this::toInstrumentInfo).toList();
    }

    private LocalDate parseDate(String timestamp) {
        if (timestamp == null || timestamp.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(timestamp.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
