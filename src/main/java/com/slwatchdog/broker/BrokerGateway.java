package com.slwatchdog.broker;

import com.slwatchdog.domain.model.BrokerHolding;
import com.slwatchdog.domain.model.DailyCandle;
import com.slwatchdog.domain.model.GttOrder;
import com.slwatchdog.domain.model.InstrumentInfo;
import com.slwatchdog.oms.ExitOrderRequest;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Broker abstraction used by every watchdog component. Failures surface as
 * {@link com.slwatchdog.exception.BrokerException} subtypes: rate limits, duplicate
 * orders and authentication problems each have their own type.
 */
public interface BrokerGateway {

    /**
     * Confirms the session is authenticated.
     *
     * @return the account's user name
     * @throws com.slwatchdog.exception.BrokerAuthException if the token is missing or rejected
     */
    String verifySession();

    /**
     * Fetches last traded prices for one batch of {@code EXCHANGE:SYMBOL} keys.
     * Callers keep batches at or below the broker's per-call limit.
     *
     * @return price by the same key; symbols the broker does not know are absent
     */
    Map<String, BigDecimal> getLastPrices(List<String> exchangeSymbols);

    /** Daily OHLC candles for an instrument, oldest first, inclusive of both dates. */
    List<DailyCandle> getDailyCandles(long instrumentToken, LocalDate from, LocalDate to);

    /**
     * Open CNC positions merged with demat holdings (T1 quantity included).
     * Positions win over holdings when both report the same symbol.
     */
    List<BrokerHolding> getOpenPositions();

    /**
     * Places an exit order.
     *
     * @return the broker order id
     */
    String placeOrder(ExitOrderRequest request);

    List<GttOrder> getGttOrders();

    void cancelGttOrder(int gttId);

    /** Full instrument list for one exchange. */
    List<InstrumentInfo> getInstruments(String exchange);
}
