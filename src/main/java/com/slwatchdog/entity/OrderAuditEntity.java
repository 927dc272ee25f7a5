package com.slwatchdog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the order_audit_log table. Append-only: one SUBMITTED row when an exit
 * order enters the queue and one outcome row (FILLED, DUPLICATE, FAILED) when the executor
 * is done with it, correlated by {@code correlationId}.
 *
 * <p>{@code contextJson} holds the decision snapshot (trigger price, stop, remaining
 * quantity) so an exit can be reconstructed after the fact.
 */
@Entity
@Table(
        name = "order_audit_log",
        indexes = {
            @Index(name = "idx_order_audit_ticker", columnList = "ticker"),
            @Index(name = "idx_order_audit_correlation", columnList = "correlation_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "correlation_id", length = 36, nullable = false)
    private String correlationId;

    @Column(length = 50, nullable = false)
    private String ticker;

    @Column(length = 20, nullable = false)
    private String event;

    @Column(name = "tranche_id", length = 30)
    private String trancheId;

    @Column(length = 4)
    private String side;

    @Column(name = "order_type", length = 10)
    private String orderType;

    @Column(name = "requested_quantity")
    private Integer requestedQuantity;

    @Column(name = "filled_quantity")
    private Integer filledQuantity;

    @Column(name = "limit_price", precision = 19, scale = 4)
    private BigDecimal limitPrice;

    @Column(name = "broker_order_id", length = 40)
    private String brokerOrderId;

    private Integer attempts;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    @Column(name = "context_json", length = 2000)
    private String contextJson;

    private LocalDateTime timestamp;
}
