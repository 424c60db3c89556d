package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.DatabaseConnectionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DatabaseConnectionJpaRepository extends JpaRepository<DatabaseConnectionEntity, Long> {
}
