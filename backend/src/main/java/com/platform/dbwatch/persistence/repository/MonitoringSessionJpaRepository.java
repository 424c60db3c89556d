package com.platform.dbwatch.persistence.repository;

import com.platform.dbwatch.monitoring.SessionState;
import com.platform.dbwatch.persistence.entity.MonitoringSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for monitoring sessions.
 * 
 * Sampling cycles and stop requests race on the same row, so cycle bookkeeping
 * is written with conditional column updates instead of whole-entity saves.
 */
@Repository
public interface MonitoringSessionJpaRepository extends JpaRepository<MonitoringSessionEntity, Long> {
    
    Optional<MonitoringSessionEntity> findByDatabaseId(Long databaseId);
    
    List<MonitoringSessionEntity> findByActiveTrue();
    
    /**
     * Move an active session to a new state. Returns 0 when the session was stopped meanwhile.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE MonitoringSessionEntity s SET s.state = :state, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.active = true")
    int updateStateIfActive(@Param("id") Long id, @Param("state") SessionState state, @Param("now") Instant now);
    
    /**
     * Record the end of a sampling cycle on a session that is still active.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE MonitoringSessionEntity s SET s.lastRunAt = :lastRunAt, s.state = :state, " +
           "s.lastCycleError = :error, s.updatedAt = :lastRunAt WHERE s.id = :id AND s.active = true")
    int recordCycleIfActive(
        @Param("id") Long id,
        @Param("lastRunAt") Instant lastRunAt,
        @Param("state") SessionState state,
        @Param("error") String error
    );
    
    /**
     * Flip the active flag off and mark the session stopped.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE MonitoringSessionEntity s SET s.active = false, s.state = :state, " +
           "s.stoppedAt = :now, s.updatedAt = :now WHERE s.id = :id")
    int deactivate(@Param("id") Long id, @Param("state") SessionState state, @Param("now") Instant now);
}
