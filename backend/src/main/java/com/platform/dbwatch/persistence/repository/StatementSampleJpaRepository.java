package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.StatementSampleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface StatementSampleJpaRepository extends JpaRepository<StatementSampleEntity, Long> {
    
    Optional<StatementSampleEntity> findByCanonicalStatementIdAndRawHash(Long canonicalStatementId, String rawHash);
    
    List<StatementSampleEntity> findByCanonicalStatementIdIn(Collection<Long> canonicalStatementIds);
    
    List<StatementSampleEntity> findByCanonicalStatementIdOrderByLastUpdatedAtDesc(Long canonicalStatementId);
}
