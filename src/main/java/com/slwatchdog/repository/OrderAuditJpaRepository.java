package com.slwatchdog.repository;

import com.slwatchdog.entity.OrderAuditEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the order_audit_log table. */
@Repository
public interface OrderAuditJpaRepository extends JpaRepository<OrderAuditEntity, Long> {

    List<OrderAuditEntity> findByTickerOrderByTimestampAsc(String ticker);

    List<OrderAuditEntity> findByCorrelationIdOrderByTimestampAsc(String correlationId);
}
