package com.slwatchdog.unit.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.PositionSource;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.exception.WatchdogStartupException;
import com.slwatchdog.runner.OrdersFileLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for OrdersFileLoader: both recognised entry shapes, skipping of unusable
 * entries and merging of repeated tickers.
 */
class OrdersFileLoaderTest {

    private static final Instant NOW = Instant.parse("2026-03-10T03:30:00Z");

    @TempDir
    Path tempDir;

    private OrdersFileLoader loader;

    @BeforeEach
    void setUp() {
        loader = new OrdersFileLoader(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("orders.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Reads placed orders and synced broker fills")
    void bothShapes() throws IOException {
        Path file = write("""
                {"orders": [
                  {"order_success": true, "ticker": "infy", "position_size": 10,
                   "current_price": 1500.5, "investment_amount": 15005},
                  {"data_source": "server_sync", "status": "COMPLETE", "transaction_type": "BUY",
                   "tradingsymbol": "TCS", "filled_quantity": 4, "average_price": "3400"}
                ]}
                """);

        List<Position> positions = loader.load(file, "NSE", "CNC");

        assertThat(positions).extracting(Position::getTicker).containsExactly("INFY", "TCS");
        Position infy = positions.get(0);
        assertThat(infy.getQuantity()).isEqualTo(10);
        assertThat(infy.getOriginalQuantity()).isEqualTo(10);
        assertThat(infy.getEntryPrice()).isEqualByComparingTo("1500.5");
        assertThat(infy.getInvestmentAmount()).isEqualByComparingTo("15005");
        assertThat(infy.getSide()).isEqualTo(PositionSide.LONG);
        assertThat(infy.getSource()).isEqualTo(PositionSource.ORDERS_FILE);
        assertThat(infy.getExchange()).isEqualTo("NSE");
        assertThat(infy.getOpenedAt()).isEqualTo(NOW);
        assertThat(positions.get(1).getInvestmentAmount()).isEqualByComparingTo("13600");
    }

    @Test
    @DisplayName("Skips failed, sell, incomplete and zero-quantity entries")
    void skipsUnusable() throws IOException {
        Path file = write("""
                {"orders": [
                  {"order_success": false, "ticker": "AAA", "position_size": 10, "current_price": 10},
                  {"data_source": "server_sync", "status": "COMPLETE", "transaction_type": "SELL",
                   "tradingsymbol": "BBB", "filled_quantity": 5, "average_price": 20},
                  {"data_source": "server_sync", "status": "OPEN", "transaction_type": "BUY",
                   "tradingsymbol": "CCC", "filled_quantity": 5, "average_price": 20},
                  {"order_success": true, "ticker": "DDD", "position_size": 0, "current_price": 10},
                  {"order_success": true, "ticker": "EEE", "position_size": 3, "current_price": "n/a"}
                ]}
                """);

        assertThat(loader.load(file, "NSE", "CNC")).isEmpty();
    }

    @Test
    @DisplayName("Merges repeated tickers with a weighted entry price")
    void mergesDuplicates() throws IOException {
        Path file = write("""
                {"orders": [
                  {"order_success": true, "ticker": "SBIN", "position_size": 10, "current_price": 100},
                  {"order_success": true, "ticker": "SBIN", "position_size": 30, "current_price": 110}
                ]}
                """);

        List<Position> positions = loader.load(file, "NSE", "CNC");

        assertThat(positions).hasSize(1);
        Position sbin = positions.get(0);
        assertThat(sbin.getQuantity()).isEqualTo(40);
        assertThat(sbin.getOriginalQuantity()).isEqualTo(40);
        assertThat(sbin.getEntryPrice()).isEqualByComparingTo("107.5");
        assertThat(sbin.getInvestmentAmount()).isEqualByComparingTo("4300");
    }

    @Test
    @DisplayName("A file without an orders array yields nothing")
    void noOrdersArray() throws IOException {
        assertThat(loader.load(write("{\"positions\": []}"), "NSE", "CNC")).isEmpty();
    }

    @Test
    @DisplayName("Unreadable files are startup failures")
    void unreadable() throws IOException {
        assertThatThrownBy(() -> loader.load(write("{not json"), "NSE", "CNC"))
                .isInstanceOf(WatchdogStartupException.class);
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json"), "NSE", "CNC"))
                .isInstanceOf(WatchdogStartupException.class);
    }
}
