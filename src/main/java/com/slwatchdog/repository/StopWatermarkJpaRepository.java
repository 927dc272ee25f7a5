package com.slwatchdog.repository;

import com.slwatchdog.entity.StopWatermarkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StopWatermarkJpaRepository extends JpaRepository<StopWatermarkEntity, String> {}
