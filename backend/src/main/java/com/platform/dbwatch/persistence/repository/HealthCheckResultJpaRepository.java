package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.HealthCheckResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HealthCheckResultJpaRepository extends JpaRepository<HealthCheckResultEntity, Long> {
    
    List<HealthCheckResultEntity> findByExecutionIdOrderByIdAsc(Long executionId);
}
