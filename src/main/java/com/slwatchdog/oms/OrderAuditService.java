package com.slwatchdog.oms;

import com.slwatchdog.entity.OrderAuditEntity;
import com.slwatchdog.mapper.JsonHelper;
import com.slwatchdog.repository.OrderAuditJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Writes the order audit trail: a SUBMITTED row per queued exit order and one outcome
 * row per completed execution.
 *
 * <p>Audit writes never block an exit. A database failure is logged at ERROR with the
 * full order context (so the log file remains a complete trail) and execution continues.
 */
@Service
public class OrderAuditService {

    private static final Logger log = LoggerFactory.getLogger(OrderAuditService.class);

    static final String EVENT_SUBMITTED = "SUBMITTED";

    private final OrderAuditJpaRepository orderAuditJpaRepository;
    private final Clock clock;

    public OrderAuditService(OrderAuditJpaRepository orderAuditJpaRepository, Clock clock) {
        this.orderAuditJpaRepository = orderAuditJpaRepository;
        this.clock = clock;
    }

    public void recordSubmission(ExitOrderRequest request) {
        log.info(
                "Exit order submitted: ticker={}, tranche={}, reason={}, side={}, type={}, qty={}, limit={}, trigger={}, remainingAfter={}, correlationId={}",
                request.getTicker(),
                request.getTrancheId(),
                request.getReason(),
                request.getSide(),
                request.getOrderType(),
                request.getQuantity(),
                request.getLimitPrice(),
                request.getTriggerPrice(),
                request.getRemainingQuantityAfterFill(),
                request.getCorrelationId());
        save(baseRow(request, EVENT_SUBMITTED).build());
    }

    public void recordOutcome(OrderOutcome outcome) {
        ExitOrderRequest request = outcome.getRequest();
        if (outcome.getStatus().isSuccess()) {
            log.info(
                    "Exit order {}: ticker={}, tranche={}, brokerOrderId={}, requested={}, filled={}, price={}, attempts={}",
                    outcome.getStatus(),
                    request.getTicker(),
                    request.getTrancheId(),
                    outcome.getBrokerOrderId(),
                    request.getQuantity(),
                    outcome.getFilledQuantity(),
                    request.getLimitPrice() != null ? request.getLimitPrice() : "MARKET",
                    outcome.getAttempts());
        } else {
            log.error(
                    "Exit order FAILED: ticker={}, tranche={}, requested={}, price={}, attempts={}, error={}",
                    request.getTicker(),
                    request.getTrancheId(),
                    request.getQuantity(),
                    request.getLimitPrice() != null ? request.getLimitPrice() : "MARKET",
                    outcome.getAttempts(),
                    outcome.getErrorMessage());
        }
        save(baseRow(request, outcome.getStatus().name())
                .filledQuantity(outcome.getFilledQuantity())
                .brokerOrderId(outcome.getBrokerOrderId())
                .attempts(outcome.getAttempts())
                .errorMessage(truncate(outcome.getErrorMessage(), 500))
                .build());
    }

    private OrderAuditEntity.OrderAuditEntityBuilder baseRow(ExitOrderRequest request, String event) {
        return OrderAuditEntity.builder()
                .correlationId(request.getCorrelationId())
                .ticker(request.getTicker())
                .event(event)
                .trancheId(request.getTrancheId())
                .side(request.getSide().name())
                .orderType(request.getOrderType().name())
                .requestedQuantity(request.getQuantity())
                .limitPrice(request.getLimitPrice())
                .contextJson(JsonHelper.toJson(context(request)))
                .timestamp(LocalDateTime.now(clock));
    }

    private Map<String, Object> context(ExitOrderRequest request) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("reason", request.getReason());
        context.put("exchange", request.getExchange());
        context.put("product", request.getProduct());
        context.put("triggerPrice", request.getTriggerPrice());
        context.put("remainingQuantityAfterFill", request.getRemainingQuantityAfterFill());
        context.put("decidedAt", request.getCreatedAt());
        return context;
    }

    private void save(OrderAuditEntity entity) {
        try {
            orderAuditJpaRepository.save(entity);
        } catch (DataAccessException e) {
            log.error(
                    "Failed to persist order audit row: ticker={}, event={}, correlationId={}",
                    entity.getTicker(),
                    entity.getEvent(),
                    entity.getCorrelationId(),
                    e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
