package com.slwatchdog.entity;

import com.slwatchdog.domain.enums.PositionSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the stop_watermarks table: the most favourable stop ever computed per
 * ticker. Survives restarts so a restarted watchdog never loosens a stop it already used.
 */
@Entity
@Table(name = "stop_watermarks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StopWatermarkEntity {

    @Id
    @Column(length = 50)
    private String ticker;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private PositionSide side;

    @Column(name = "stop_price", precision = 19, scale = 4, nullable = false)
    private BigDecimal stopPrice;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
