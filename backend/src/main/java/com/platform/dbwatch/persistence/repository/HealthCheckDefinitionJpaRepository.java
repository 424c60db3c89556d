package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.HealthCheckDefinitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface HealthCheckDefinitionJpaRepository extends JpaRepository<HealthCheckDefinitionEntity, Long> {
    
    List<HealthCheckDefinitionEntity> findByActiveTrueOrderByDisplayOrderAscIdAsc();
    
    Optional<HealthCheckDefinitionEntity> findByTitle(String title);
}
