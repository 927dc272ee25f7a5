package com.slwatchdog.stop;

import com.slwatchdog.domain.enums.PositionSide;
import com.slwatchdog.entity.StopWatermarkEntity;
import com.slwatchdog.repository.StopWatermarkJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent monotonic watermark of the best stop per ticker.
 *
 * <p>{@link #raise} only ever tightens: for LONG the stored price can only go up, for
 * SHORT only down. A stored watermark for the opposite side is stale (the ticker was
 * closed and re-entered the other way) and is replaced.
 */
@Service
public class StopWatermarkService {

    private static final Logger log = LoggerFactory.getLogger(StopWatermarkService.class);

    private final StopWatermarkJpaRepository stopWatermarkJpaRepository;
    private final Clock clock;

    public StopWatermarkService(StopWatermarkJpaRepository stopWatermarkJpaRepository, Clock clock) {
        this.stopWatermarkJpaRepository = stopWatermarkJpaRepository;
        this.clock = clock;
    }

    public Optional<BigDecimal> find(String ticker, PositionSide side) {
        return stopWatermarkJpaRepository
                .findById(ticker)
                .filter(w -> w.getSide() == side)
                .map(StopWatermarkEntity::getStopPrice);
    }

    /**
     * Stores {@code stopPrice} if it is more favourable than the stored watermark.
     *
     * @return the watermark after the call
     */
    @Transactional
    public BigDecimal raise(String ticker, PositionSide side, BigDecimal stopPrice) {
        Optional<StopWatermarkEntity> existing = stopWatermarkJpaRepository.findById(ticker);
        if (existing.isPresent() && existing.get().getSide() == side) {
            BigDecimal stored = existing.get().getStopPrice();
            if (!isTighter(side, stopPrice, stored)) {
                return stored;
            }
        }
        StopWatermarkEntity entity = existing.orElseGet(StopWatermarkEntity::new);
        entity.setTicker(ticker);
        entity.setSide(side);
        entity.setStopPrice(stopPrice);
        entity.setUpdatedAt(LocalDateTime.now(clock));
        stopWatermarkJpaRepository.save(entity);
        log.debug("Stop watermark raised: ticker={}, side={}, stop={}", ticker, side, stopPrice);
        return stopPrice;
    }

    /** Removes the watermark once the position is fully closed. */
    @Transactional
    public void clear(String ticker) {
        if (stopWatermarkJpaRepository.existsById(ticker)) {
            stopWatermarkJpaRepository.deleteById(ticker);
            log.info("Stop watermark cleared: ticker={}", ticker);
        }
    }

    static boolean isTighter(PositionSide side, BigDecimal candidate, BigDecimal current) {
        return side == PositionSide.LONG ? candidate.compareTo(current) > 0 : candidate.compareTo(current) < 0;
    }
}
