package com.slwatchdog.broker.mapper;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.PositionSource;
import com.slwatchdog.domain.model.BrokerHolding;
import com.zerodhatech.models.Holding;
import com.zerodhatech.models.Position;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps Kite positions and holdings to {@link BrokerHolding}.
 *
 * <p>Kite SDK models mix primitive, boxed and String numerics (instrumentToken is a
 * String, netQuantity an int, lastPrice a Double), so every numeric field goes through
 * the null-safe converters below.
 *
 * <p>Only CNC (delivery) positions are of interest. A CNC net row with a zero or
 * negative quantity records delivery shares sold today, not an open position, and is
 * not mapped; the demat holding for that symbol stands instead.
 */
@Component
public class KitePositionMapper {

    private static final String CNC = "CNC";

    /** Returns null for a null or non-positive net row. */
    public BrokerHolding fromPosition(Position position) {
        if (position == null) {
            return null;
        }
        int netQuantity = toInt(position.netQuantity);
        if (netQuantity <= 0) {
            return null;
        }
        return BrokerHolding.builder()
                .tradingSymbol(position.tradingSymbol)
                .exchange(position.exchange)
                .product(position.product)
                .instrumentToken(parseInstrumentToken(position.instrumentToken))
                .side(PositionSide.LONG)
                .quantity(netQuantity)
                .averagePrice(toBigDecimal(position.averagePrice))
                .lastPrice(toBigDecimal(position.lastPrice))
                .source(PositionSource.BROKER_POSITION)
                .build();
    }

    /** Holdings include T1 shares (bought yesterday, not yet settled) in the tracked quantity. */
    public BrokerHolding fromHolding(Holding holding) {
        if (holding == null) {
            return null;
        }
        int quantity = toInt(holding.quantity) + toInt(holding.t1Quantity);
        return BrokerHolding.builder()
                .tradingSymbol(holding.tradingSymbol)
                .exchange(holding.exchange)
                .product(holding.product != null ? holding.product : CNC)
                .instrumentToken(parseInstrumentToken(holding.instrumentToken))
                .side(PositionSide.LONG)
                .quantity(quantity)
                .averagePrice(toBigDecimal(holding.averagePrice))
                .lastPrice(toBigDecimal(holding.lastPrice))
                .source(PositionSource.BROKER_HOLDING)
                .build();
    }

    /**
     * Merges net CNC positions with holdings. Zero-quantity and sold-down net rows are
     * dropped and a symbol reported by both keeps the position entry.
     */
    public List<BrokerHolding> merge(List<Position> netPositions, List<Holding> holdings) {
        Map<String, BrokerHolding> bySymbol = new LinkedHashMap<>();
        if (netPositions != null) {
            for (Position position : netPositions) {
                if (position == null || !CNC.equalsIgnoreCase(position.product)) {
                    continue;
                }
                BrokerHolding mapped = fromPosition(position);
                if (mapped != null) {
                    bySymbol.put(mapped.getTradingSymbol(), mapped);
                }
            }
        }
        if (holdings != null) {
            for (Holding holding : holdings) {
                BrokerHolding mapped = fromHolding(holding);
                if (mapped != null && mapped.getQuantity() > 0) {
                    bySymbol.putIfAbsent(mapped.getTradingSymbol(), mapped);
                }
            }
        }
        return List.copyOf(bySymbol.values());
    }

    // ---- Helpers ----

    private Long parseInstrumentToken(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static int toInt(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
