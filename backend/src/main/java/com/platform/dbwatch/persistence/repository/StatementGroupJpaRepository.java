package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.StatementGroupEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StatementGroupJpaRepository extends JpaRepository<StatementGroupEntity, Long> {
    
    List<StatementGroupEntity> findByDatabaseIdOrderByNameAsc(Long databaseId);
}
