package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.ClusterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClusterJpaRepository extends JpaRepository<ClusterEntity, Long> {
}
