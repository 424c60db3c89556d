package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.observability.LoggingConfig;
import com.platform.dbwatch.observability.MetricsRegistry;
import com.platform.dbwatch.persistence.entity.MonitoringSessionEntity;
import com.platform.dbwatch.persistence.repository.MonitoringSessionJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Resumes monitoring sessions that were active when the application last stopped.
 * 
 * Recovery Logic:
 * 1. Find all records with active=true
 * 2. If scheduledEndTime is in the past, mark STOPPED
 * 3. Otherwise register a fresh loop and run its first cycle immediately
 */
@Slf4j
@Component
public class MonitoringRecoveryService {
    
    private final MonitoringSessionJpaRepository sessionRepository;
    private final MonitoringTaskRegistry taskRegistry;
    private final SamplingCycleExecutor cycleExecutor;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final boolean enabled;
    
    public MonitoringRecoveryService(
            MonitoringSessionJpaRepository sessionRepository,
            MonitoringTaskRegistry taskRegistry,
            SamplingCycleExecutor cycleExecutor,
            MetricsRegistry metricsRegistry,
            Clock clock,
            @Value("${dbwatch.monitoring.recovery.enabled:true}") boolean enabled) {
        this.sessionRepository = sessionRepository;
        this.taskRegistry = taskRegistry;
        this.cycleExecutor = cycleExecutor;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.enabled = enabled;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE + 100)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Monitoring recovery disabled");
            return;
        }
        recoverActiveSessions();
    }
    
    public void recoverActiveSessions() {
        List<MonitoringSessionEntity> activeSessions = sessionRepository.findByActiveTrue();
        if (activeSessions.isEmpty()) {
            log.info("No active monitoring sessions to recover");
            return;
        }
        
        Instant now = clock.instant();
        int resumed = 0;
        int expired = 0;
        int failed = 0;
        for (MonitoringSessionEntity session : activeSessions) {
            try {
                LoggingConfig.setSessionContext(session.getDatabaseId(), session.getId());
                
                if (session.getScheduledEndTime() != null && !now.isBefore(session.getScheduledEndTime())) {
                    sessionRepository.deactivate(session.getId(), SessionState.STOPPED, now);
                    log.info("Session {} ended at {} while the application was down",
                        session.getId(), session.getScheduledEndTime());
                    expired++;
                    continue;
                }
                
                SamplingTask task = new SamplingTask(session.getId(), session.getDatabaseId(), session.getIntervalSeconds());
                if (!taskRegistry.register(task)) {
                    log.warn("Database {} already has a sampling loop, not resuming session {}",
                        session.getDatabaseId(), session.getId());
                    continue;
                }
                cycleExecutor.scheduleNow(task);
                resumed++;
            } catch (Exception e) {
                log.error("Failed to recover monitoring session {}: {}", session.getId(), e.getMessage(), e);
                failed++;
            } finally {
                LoggingConfig.clearSessionContext();
            }
        }
        
        log.info("Monitoring recovery complete: resumed={}, expired={}, failed={}", resumed, expired, failed);
        metricsRegistry.recordSessionRecovery(resumed, expired, failed);
    }
}
