package com.slwatchdog.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.PositionSource;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.exception.WatchdogStartupException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads positions from an orders file: a JSON object with an {@code orders} array.
 *
 * <p>Two entry shapes are recognised, both producing LONG positions:
 * <ul>
 *   <li>placed orders: {@code order_success=true} with {@code ticker},
 *       {@code position_size}, {@code current_price} and optional {@code investment_amount};</li>
 *   <li>synced broker fills: {@code data_source=server_sync}, {@code status=COMPLETE},
 *       {@code transaction_type=BUY}, {@code filled_quantity > 0}, with
 *       {@code tradingsymbol} and {@code average_price}.</li>
 * </ul>
 * Anything else is skipped. Entries for the same ticker are merged: quantities add up and
 * the entry price becomes the quantity-weighted average.
 */
@Component
public class OrdersFileLoader {

    private static final Logger log = LoggerFactory.getLogger(OrdersFileLoader.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OrdersFileLoader(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public List<Position> load(Path file, String exchange, String product) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new WatchdogStartupException("Cannot read orders file " + file, e);
        }
        JsonNode orders = root == null ? null : root.get("orders");
        if (orders == null || !orders.isArray()) {
            log.warn("Orders file has no 'orders' array: file={}", file);
            return List.of();
        }

        Map<String, Position> byTicker = new LinkedHashMap<>();
        int skipped = 0;
        for (JsonNode order : orders) {
            Position parsed = parse(order, exchange, product);
            if (parsed == null) {
                skipped++;
                continue;
            }
            byTicker.merge(parsed.getTicker(), parsed, OrdersFileLoader::combine);
        }
        log.info("Orders file loaded: file={}, positions={}, skippedEntries={}", file, byTicker.size(), skipped);
        return new ArrayList<>(byTicker.values());
    }

    private Position parse(JsonNode order, String exchange, String product) {
        String ticker;
        int quantity;
        BigDecimal price;
        BigDecimal investment = null;

        if (order.path("order_success").asBoolean(false)) {
            ticker = order.path("ticker").asText("");
            quantity = order.path("position_size").asInt(0);
            price = decimal(order.get("current_price"));
            investment = decimal(order.get("investment_amount"));
        } else if ("server_sync".equals(order.path("data_source").asText())
                && "COMPLETE".equalsIgnoreCase(order.path("status").asText())
                && "BUY".equalsIgnoreCase(order.path("transaction_type").asText())) {
            ticker = order.path("tradingsymbol").asText("");
            quantity = order.path("filled_quantity").asInt(0);
            price = decimal(order.get("average_price"));
        } else {
            return null;
        }

        if (ticker.isBlank() || quantity <= 0 || price == null || price.signum() <= 0) {
            log.debug("Skipping incomplete order entry: {}", order);
            return null;
        }
        if (investment == null) {
            investment = price.multiply(BigDecimal.valueOf(quantity));
        }
        return Position.builder()
                .ticker(ticker.trim().toUpperCase(Locale.ROOT))
                .exchange(exchange)
                .product(product)
                .side(PositionSide.LONG)
                .quantity(quantity)
                .originalQuantity(quantity)
                .entryPrice(price)
                .investmentAmount(investment)
                .source(PositionSource.ORDERS_FILE)
                .openedAt(clock.instant())
                .build();
    }

    private static Position combine(Position a, Position b) {
        int quantity = a.getQuantity() + b.getQuantity();
        BigDecimal investment = a.getInvestmentAmount().add(b.getInvestmentAmount());
        BigDecimal weighted = a.getEntryPrice()
                .multiply(BigDecimal.valueOf(a.getQuantity()))
                .add(b.getEntryPrice().multiply(BigDecimal.valueOf(b.getQuantity())))
                .divide(BigDecimal.valueOf(quantity), 4, RoundingMode.HALF_UP);
        return a.toBuilder()
                .quantity(quantity)
                .originalQuantity(quantity)
                .entryPrice(weighted)
                .investmentAmount(investment)
                .build();
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            log.debug("Unparseable number in orders file: {}", text);
            return null;
        }
    }
}
