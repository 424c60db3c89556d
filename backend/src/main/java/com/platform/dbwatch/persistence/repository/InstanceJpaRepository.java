package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.InstanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InstanceJpaRepository extends JpaRepository<InstanceEntity, Long> {
    
    List<InstanceEntity> findByClusterIdOrderByIdAsc(Long clusterId);
}
