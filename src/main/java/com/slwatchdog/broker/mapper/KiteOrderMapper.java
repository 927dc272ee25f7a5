package com.slwatchdog.broker.mapper;

import com.slwatchdog.domain.enums.OrderSide;
import com.slwatchdog.domain.enums.OrderType;
import com.slwatchdog.domain.model.GttOrder;
import com.slwatchdog.oms.ExitOrderRequest;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.GTT;
import com.zerodhatech.models.OrderParams;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Maps exit orders to Kite {@link OrderParams} and Kite GTT objects to {@link GttOrder}.
 *
 * <p>Kite SDK models use public fields, so all conversions are manual.
 */
@Component
public class KiteOrderMapper {

    /**
     * Builds placement params. Exchange defaults to NSE and product to CNC when the
     * request leaves them empty. Price is only sent for LIMIT orders.
     */
    public OrderParams toOrderParams(ExitOrderRequest request) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = request.getTicker();
        params.exchange = request.getExchange() != null ? request.getExchange() : Constants.EXCHANGE_NSE;
        params.transactionType = request.getSide() == OrderSide.BUY
                ? Constants.TRANSACTION_TYPE_BUY
                : Constants.TRANSACTION_TYPE_SELL;
        params.quantity = request.getQuantity();
        params.product = request.getProduct() != null ? request.getProduct() : Constants.PRODUCT_CNC;
        params.validity = Constants.VALIDITY_DAY;

        if (request.getOrderType() == OrderType.LIMIT && request.getLimitPrice() != null) {
            params.orderType = Constants.ORDER_TYPE_LIMIT;
            params.price = request.getLimitPrice().doubleValue();
        } else {
            params.orderType = Constants.ORDER_TYPE_MARKET;
        }
        return params;
    }

    public GttOrder toGttOrder(GTT gtt) {
        if (gtt == null) {
            return null;
        }
        return GttOrder.builder()
                .id(gtt.id)
                .tradingSymbol(gtt.condition != null ? gtt.condition.tradingSymbol : null)
                .exchange(gtt.condition != null ? gtt.condition.exchange : null)
                .status(gtt.status)
                .build();
    }

    public List<GttOrder> toGttOrders(List<GTT> gtts) {
        if (gtts == null) {
            return List.of();
        }
        return gtts.stream().map(this::toGttOrder).filter(Objects::nonNull).toList();
    }
}
