package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.HealthCheckExecutionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HealthCheckExecutionJpaRepository extends JpaRepository<HealthCheckExecutionEntity, Long> {
    
    List<HealthCheckExecutionEntity> findByClusterIdOrderByStartedAtDesc(Long clusterId);
}
