package com.slwatchdog.exception;

import java.util.Map;

public class InstrumentNotFoundException extends BaseException {

    public InstrumentNotFoundException(String exchange, String tradingSymbol) {
        super(
                ErrorCode.INSTRUMENT_NOT_FOUND,
                "Instrument not found: " + exchange + ":" + tradingSymbol,
                Map.of("exchange", exchange, "tradingSymbol", tradingSymbol));
    }
}
