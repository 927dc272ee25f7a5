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
import org.springframework.stereotype.Component;

/**
 * Kite Connect implementation of {@link BrokerGateway}. Pure delegation to the
 * internal Kite services so that the resilience4j proxies around them stay in effect.
 */
@Component
public class KiteBrokerGateway implements BrokerGateway {

    private final KiteSessionService kiteSessionService;
    private final KiteMarketDataService kiteMarketDataService;
    private final KitePositionService kitePositionService;
    private final KiteOrderService kiteOrderService;

    public KiteBrokerGateway(
            KiteSessionService kiteSessionService,
            KiteMarketDataService kiteMarketDataService,
            KitePositionService kitePositionService,
            KiteOrderService kiteOrderService) {
        this.kiteSessionService = kiteSessionService;
        this.kiteMarketDataService = kiteMarketDataService;
        this.kitePositionService = kitePositionService;
        this.kiteOrderService = kiteOrderService;
    }

    @Override
    public String verifySession() {
        return kiteSessionService.verifySession();
    }

    @Override
    public Map<String, BigDecimal> getLastPrices(List<String> exchangeSymbols) {
        return kiteMarketDataService.getLastPrices(exchangeSymbols);
    }

    @Override
    public List<DailyCandle> getDailyCandles(long instrumentToken, LocalDate from, LocalDate to) {
        return kiteMarketDataService.getDailyCandles(instrumentToken, from, to);
    }

    @Override
    public List<BrokerHolding> getOpenPositions() {
        return kitePositionService.getOpenPositions();
    }

    @Override
    public String placeOrder(ExitOrderRequest request) {
        return kiteOrderService.placeOrder(request);
    }

    @Override
    public List<GttOrder> getGttOrders() {
        return kiteOrderService.getGttOrders();
    }

    @Override
    public void cancelGttOrder(int gttId) {
        kiteOrderService.cancelGttOrder(gttId);
    }

    @Override
    public List<InstrumentInfo> getInstruments(String exchange) {
        return kiteMarketDataService.getInstruments(exchange);
    }
}
