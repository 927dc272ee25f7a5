package com.slwatchdog.broker;

import com.slwatchdog.broker.mapper.KiteOrderMapper;
import com.slwatchdog.domain.model.GttOrder;
import com.slwatchdog.exception.BrokerException;
import com.slwatchdog.oms.ExitOrderRequest;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.util.List;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Internal service that executes order operations against the Kite Connect API.
 *
 * <p>Order placement is only rate limited ({@code kiteOrders}). Retrying a placement is
 * the job of {@link com.slwatchdog.oms.OrderExecutor}, which needs to see every attempt
 * to classify duplicates and count retries. GTT reads and cancels use the shared
 * {@code kiteApi} circuit breaker.
 *
 * <p>All methods wrap Kite's checked exceptions into unchecked {@link BrokerException}
 * subtypes via {@link KiteErrorTranslator}.
 */
@Service
public class KiteOrderService {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderService.class);

    private final KiteConnect kiteConnect;
    private final KiteOrderMapper kiteOrderMapper;

    public KiteOrderService(KiteConnect kiteConnect, KiteOrderMapper kiteOrderMapper) {
        this.kiteConnect = kiteConnect;
        this.kiteOrderMapper = kiteOrderMapper;
    }

    /**
     * Places an exit order using regular variety.
     *
     * @return the Kite-assigned order id
     */
    @RateLimiter(name = "kiteOrders")
    public String placeOrder(ExitOrderRequest request) {
        OrderParams params = kiteOrderMapper.toOrderParams(request);
        try {
            Order kiteOrder = kiteConnect.placeOrder(params, Constants.VARIETY_REGULAR);
            log.info(
                    "Order placed: orderId={} symbol={} side={} type={} qty={} price={}",
                    kiteOrder.orderId,
                    request.getTicker(),
                    request.getSide(),
                    params.orderType,
                    request.getQuantity(),
                    request.getLimitPrice());
            return kiteOrder.orderId;
        } catch (KiteException e) {
            log.warn("Kite order placement failed for {}: code={}, message={}", request.getTicker(), e.code, e.message);
            throw KiteErrorTranslator.translate("Order placement", e);
        } catch (JSONException | IOException e) {
            log.warn("Order placement error for {}: {}", request.getTicker(), e.getMessage());
            throw new BrokerException("Order placement error: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteQuotes")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<GttOrder> getGttOrders() {
        try {
            return kiteOrderMapper.toGttOrders(kiteConnect.getGTTs());
        } catch (KiteException e) {
            log.error("Failed to fetch GTT orders: {}", e.message);
            throw KiteErrorTranslator.translate("GTT fetch", e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching GTT orders", e);
            throw new BrokerException("Error fetching GTT orders: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    public void cancelGttOrder(int gttId) {
        try {
            kiteConnect.cancelGTT(gttId);
            log.info("GTT cancelled: id={}", gttId);
        } catch (KiteException e) {
            log.error("GTT cancellation failed for {}: {}", gttId, e.message);
            throw KiteErrorTranslator.translate("GTT cancellation", e);
        } catch (JSONException | IOException e) {
            log.error("GTT cancellation error for {}", gttId, e);
            throw new BrokerException("GTT cancellation error: " + e.getMessage(), e);
        }
    }
}
