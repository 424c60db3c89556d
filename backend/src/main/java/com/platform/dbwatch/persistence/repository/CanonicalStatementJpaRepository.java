package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.persistence.entity.CanonicalStatementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Spring Data JPA repository for canonical statements.
 * Filtered listing goes through specifications built by the observation store.
 */
@Repository
public interface CanonicalStatementJpaRepository extends JpaRepository<CanonicalStatementEntity, Long>,
        JpaSpecificationExecutor<CanonicalStatementEntity> {
    
    /**
     * Natural key lookup used by upserts.
     */
    Optional<CanonicalStatementEntity> findByDatabaseIdAndCanonicalHash(Long databaseId, String canonicalHash);
    
    /**
     * Detach every statement from a group that is about to be deleted.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE CanonicalStatementEntity c SET c.groupId = NULL WHERE c.groupId = :groupId")
    int clearGroup(@Param("groupId") Long groupId);
}
