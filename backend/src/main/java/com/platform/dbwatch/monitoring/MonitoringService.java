package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.connectors.TargetResolver;
import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.MonitoringConflictException;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.error.ValidationException;
import com.platform.dbwatch.observability.LoggingConfig;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.MonitoringSessionEntity;
import com.platform.dbwatch.persistence.repository.MonitoringSessionJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Starts, stops and reports on per-database statement sampling.
 * 
 * Each database has a single session record that is reused across starts; the live
 * loop behind it is tracked by {@link MonitoringTaskRegistry}.
 */
@Slf4j
@Service
public class MonitoringService {
    
    private final MonitoringSessionJpaRepository sessionRepository;
    private final MonitoringTaskRegistry taskRegistry;
    private final SamplingCycleExecutor cycleExecutor;
    private final TargetResolver targetResolver;
    private final EntityMappers entityMappers;
    private final Clock clock;
    private final int maxIntervalSeconds;
    
    public MonitoringService(
            MonitoringSessionJpaRepository sessionRepository,
            MonitoringTaskRegistry taskRegistry,
            SamplingCycleExecutor cycleExecutor,
            TargetResolver targetResolver,
            EntityMappers entityMappers,
            Clock clock,
            @Value("${dbwatch.monitoring.max-interval-seconds:86400}") int maxIntervalSeconds) {
        this.sessionRepository = sessionRepository;
        this.taskRegistry = taskRegistry;
        this.cycleExecutor = cycleExecutor;
        this.targetResolver = targetResolver;
        this.entityMappers = entityMappers;
        this.clock = clock;
        this.maxIntervalSeconds = maxIntervalSeconds;
    }
    
    /**
     * Start sampling a database every {@code intervalSeconds}, optionally until {@code scheduledEndTime}.
     * The first cycle is scheduled immediately.
     * 
     * @throws ValidationException if the interval is out of range
     * @throws ResourceNotFoundException if the database does not exist
     * @throws MonitoringConflictException if a loop is already running for the database, its last
     *         cycle is still finishing, or another start for it is in progress
     */
    public SessionHandle startMonitoring(long databaseId, String requestedBy, int intervalSeconds,
                                         Instant scheduledEndTime) {
        if (intervalSeconds < 1 || intervalSeconds > maxIntervalSeconds) {
            throw new ValidationException("intervalSeconds", intervalSeconds,
                "must be between 1 and " + maxIntervalSeconds);
        }
        if (!targetResolver.databaseExists(databaseId)) {
            throw new ResourceNotFoundException(ErrorCode.DATABASE_NOT_FOUND, "Database", databaseId);
        }
        if (!taskRegistry.reserve(databaseId)) {
            throw conflict(databaseId);
        }

        MonitoringSessionEntity saved;
        try {
            Instant now = clock.instant();
            MonitoringSessionEntity record = sessionRepository.findByDatabaseId(databaseId)
                .orElseGet(() -> MonitoringSessionEntity.builder().databaseId(databaseId).build());
            record.setRequestedBy(requestedBy);
            record.setActive(true);
            record.setState(SessionState.STARTING);
            record.setIntervalSeconds(intervalSeconds);
            record.setScheduledEndTime(scheduledEndTime);
            record.setStartedAt(now);
            record.setStoppedAt(null);
            record.setLastCycleError(null);
            saved = sessionRepository.save(record);
        } catch (RuntimeException e) {
            taskRegistry.release(databaseId);
            throw e;
        }

        SamplingTask task = new SamplingTask(saved.getId(), databaseId, intervalSeconds);
        taskRegistry.registerReserved(task);
        cycleExecutor.scheduleNow(task);
        
        try {
            LoggingConfig.setSessionContext(databaseId, saved.getId());
            log.info("Monitoring started by {} every {}s{}", requestedBy, intervalSeconds,
                scheduledEndTime != null ? " until " + scheduledEndTime : "");
        } finally {
            LoggingConfig.clearSessionContext();
        }
        return entityMappers.toHandle(saved);
    }

    private MonitoringConflictException conflict(long databaseId) {
        return taskRegistry.find(databaseId)
            .map(running -> new MonitoringConflictException(databaseId, running.sessionId()))
            .orElseGet(() -> new MonitoringConflictException(databaseId));
    }

    /**
     * Stop a session. The record turns inactive at once; a cycle already running finishes
     * and schedules nothing further. Until that cycle ends the database cannot be restarted.
     */
    public void stopMonitoring(long sessionId) {
        MonitoringSessionEntity record = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.SESSION_NOT_FOUND, "Monitoring session", sessionId));
        
        sessionRepository.deactivate(sessionId, SessionState.STOPPED, clock.instant());
        boolean cancelled = taskRegistry.cancelSession(sessionId).isPresent();
        log.info("Monitoring session {} for database {} stopped (loop cancelled={})",
            sessionId, record.getDatabaseId(), cancelled);
    }
    
    public SessionStatus getSessionStatus(long sessionId) {
        return sessionRepository.findById(sessionId)
            .map(entityMappers::toStatus)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.SESSION_NOT_FOUND, "Monitoring session", sessionId));
    }
    
    public Optional<SessionStatus> getSessionForDatabase(long databaseId) {
        return sessionRepository.findByDatabaseId(databaseId).map(entityMappers::toStatus);
    }
}
