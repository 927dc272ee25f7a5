package com.slwatchdog.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.slwatchdog.broker.BrokerGateway;
import com.slwatchdog.config.WatchdogProperties;
import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.domain.enums.PositionSource;
import com.slwatchdog.domain.model.BrokerHolding;
import com.slwatchdog.domain.model.Position;
import com.slwatchdog.event.PositionClosedEvent;
import com.slwatchdog.exception.BrokerAuthException;
import com.slwatchdog.ledger.PositionLedger;
import com.slwatchdog.policy.ConfiguredTickerExclusionPolicy;
import com.slwatchdog.reconciliation.PositionReconciliationService;
import com.slwatchdog.reconciliation.ReconciliationResult;
import com.slwatchdog.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for PositionReconciliationService: exclusion and ticker filtering, ledger
 * upsert, and close events for positions gone at the broker.
 */
@ExtendWith(MockitoExtension.class)
class PositionReconciliationServiceTest {

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private WatchdogProperties properties;
    private MutableClock clock;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        properties = new WatchdogProperties();
        properties.setExcludedTickers(List.of("LIQUIDBEES"));
        clock = new MutableClock(Instant.parse("2026-03-10T04:00:00Z"));
        ledger = new PositionLedger(properties, clock);
    }

    private PositionReconciliationService service() {
        return new PositionReconciliationService(
                brokerGateway, ledger, new ConfiguredTickerExclusionPolicy(properties), properties, eventPublisher, clock);
    }

    private static BrokerHolding holding(String symbol, int quantity) {
        return BrokerHolding.builder()
                .tradingSymbol(symbol)
                .exchange("NSE")
                .product("CNC")
                .side(PositionSide.LONG)
                .quantity(quantity)
                .averagePrice(new BigDecimal("100"))
                .source(PositionSource.BROKER_HOLDING)
                .build();
    }

    @Test
    @DisplayName("Startup run adds broker positions and reports excluded ones")
    void startupAddsAndExcludes() {
        when(brokerGateway.getOpenPositions()).thenReturn(List.of(holding("INFY", 10), holding("LIQUIDBEES", 500)));

        ReconciliationResult result = service().reconcile(PositionReconciliationService.TRIGGER_STARTUP);

        assertThat(result.getTrigger()).isEqualTo("STARTUP");
        assertThat(result.getAdded()).containsExactly("INFY");
        assertThat(result.getExcluded()).containsExactly("LIQUIDBEES");
        assertThat(ledger.tickers()).containsExactly("INFY");
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("A ticker filter limits which broker positions are tracked")
    void tickerFilter() {
        properties.setTickers(List.of("tcs"));
        when(brokerGateway.getOpenPositions()).thenReturn(List.of(holding("INFY", 10), holding("TCS", 5)));

        service().reconcile(PositionReconciliationService.TRIGGER_STARTUP);

        assertThat(ledger.tickers()).containsExactly("TCS");
    }

    @Test
    @DisplayName("Positions gone at the broker are removed with a close event")
    void removalPublishesEvent() {
        ledger.put(Position.builder()
                .ticker("SBIN")
                .exchange("BSE")
                .product("CNC")
                .side(PositionSide.LONG)
                .quantity(20)
                .originalQuantity(20)
                .entryPrice(new BigDecimal("800"))
                .source(PositionSource.ORDERS_FILE)
                .build());
        when(brokerGateway.getOpenPositions()).thenReturn(List.of());

        ReconciliationResult result = service().reconcile(PositionReconciliationService.TRIGGER_SCHEDULED);

        assertThat(result.getRemoved()).containsExactly("SBIN");
        ArgumentCaptor<PositionClosedEvent> captor = ArgumentCaptor.forClass(PositionClosedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getTicker()).isEqualTo("SBIN");
        assertThat(captor.getValue().getExchange()).isEqualTo("BSE");
        assertThat(captor.getValue().getCause()).isEqualTo(PositionClosedEvent.CloseCause.GONE_AT_BROKER);
    }

    @Test
    @DisplayName("Run duration is measured on the injected clock")
    void durationFromClock() {
        when(brokerGateway.getOpenPositions()).thenAnswer(invocation -> {
            clock.advance(Duration.ofMillis(250));
            return List.of(holding("INFY", 10));
        });

        ReconciliationResult result = service().reconcile(PositionReconciliationService.TRIGGER_SCHEDULED);

        assertThat(result.getDurationMs()).isEqualTo(250);
    }

    @Test
    @DisplayName("Broker failures propagate to the caller")
    void brokerFailurePropagates() {
        when(brokerGateway.getOpenPositions()).thenThrow(new BrokerAuthException("Token expired"));

        assertThatThrownBy(() -> service().reconcile(PositionReconciliationService.TRIGGER_STARTUP))
                .isInstanceOf(BrokerAuthException.class);
        assertThat(ledger.isEmpty()).isTrue();
    }
}
