package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.error.ExtensionUnavailableException;
import com.platform.dbwatch.observability.LoggingConfig;
import com.platform.dbwatch.observability.MetricsRegistry;
import com.platform.dbwatch.persistence.entity.MonitoringSessionEntity;
import com.platform.dbwatch.persistence.repository.MonitoringSessionJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs sampling cycles and chains the next one after the current one has finished,
 * so cycles of one loop never overlap.
 * 
 * Cycle:
 * 1. stop if the task was cancelled, the record is gone or inactive, or the end time passed
 * 2. mark RUNNING and sample
 * 3. record last run, RESTING and the cycle error (only while the record is still active)
 * 4. schedule the next cycle unless cancelled meanwhile, otherwise unregister the loop
 */
@Slf4j
@Component
public class SamplingCycleExecutor {
    
    private final MonitoringSessionJpaRepository sessionRepository;
    private final StatementSampler sampler;
    private final MonitoringTaskRegistry taskRegistry;
    private final TaskScheduler taskScheduler;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public SamplingCycleExecutor(
            MonitoringSessionJpaRepository sessionRepository,
            StatementSampler sampler,
            MonitoringTaskRegistry taskRegistry,
            TaskScheduler taskScheduler,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.sessionRepository = sessionRepository;
        this.sampler = sampler;
        this.taskRegistry = taskRegistry;
        this.taskScheduler = taskScheduler;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    public void scheduleNow(SamplingTask task) {
        schedule(task, Duration.ZERO);
    }
    
    void schedule(SamplingTask task, Duration delay) {
        if (task.isCancelled()) {
            return;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> runCycle(task), clock.instant().plus(delay));
        task.setPending(future);
    }
    
    public void runCycle(SamplingTask task) {
        boolean reschedule = false;
        task.beginCycle();
        LoggingConfig.setSessionContext(task.databaseId(), task.sessionId());
        try {
            if (shouldContinue(task)) {
                reschedule = executeCycle(task);
            }
        } catch (Exception e) {
            // The loop survives any failure; the next cycle starts from a fresh read of the record.
            log.error("Sampling cycle failed for database {}: {}", task.databaseId(), e.getMessage(), e);
            metricsRegistry.recordSamplingCycle("error", 0, 0);
            reschedule = true;
        } finally {
            LoggingConfig.clearSessionContext();
            task.endCycle();
        }

        // a loop cancelled while this cycle ran is removed here, not by the canceller
        if (task.isCancelled()) {
            taskRegistry.unregister(task);
        } else if (reschedule) {
            schedule(task, Duration.ofSeconds(task.intervalSeconds()));
        }
    }

    private boolean shouldContinue(SamplingTask task) {
        if (task.isCancelled()) {
            log.debug("Sampling loop for session {} cancelled", task.sessionId());
            return false;
        }
        
        Optional<MonitoringSessionEntity> record = sessionRepository.findById(task.sessionId());
        if (record.isEmpty() || !record.get().isActive()) {
            log.info("Monitoring session {} is no longer active, ending sampling loop", task.sessionId());
            endLoop(task);
            return false;
        }
        
        Instant now = clock.instant();
        Instant endTime = record.get().getScheduledEndTime();
        if (endTime != null && !now.isBefore(endTime)) {
            log.info("Monitoring session {} reached its end time {}", task.sessionId(), endTime);
            sessionRepository.deactivate(task.sessionId(), SessionState.STOPPED, now);
            metricsRegistry.recordSamplingCycle("expired", 0, 0);
            endLoop(task);
            return false;
        }
        return true;
    }
    
    /**
     * @return whether the loop should continue
     */
    private boolean executeCycle(SamplingTask task) {
        if (sessionRepository.updateStateIfActive(task.sessionId(), SessionState.RUNNING, clock.instant()) == 0) {
            log.info("Monitoring session {} was stopped before sampling", task.sessionId());
            endLoop(task);
            return false;
        }
        
        String cycleError = null;
        try {
            CycleOutcome outcome = sampler.sample(task.databaseId());
            metricsRegistry.recordSamplingCycle("success", outcome.newStatements(), outcome.updatedStatements());
            log.info("Sampled database {}: {} statements ({} new, {} updated)", task.databaseId(),
                outcome.statementsSeen(), outcome.newStatements(), outcome.updatedStatements());
        } catch (ExtensionUnavailableException e) {
            cycleError = e.getMessage();
            metricsRegistry.recordSamplingCycle("extension_unavailable", 0, 0);
            log.warn("Skipping sampling of database {}: {}", task.databaseId(), e.getMessage());
        } catch (RuntimeException e) {
            cycleError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            metricsRegistry.recordSamplingCycle("failure", 0, 0);
            log.error("Sampling database {} failed: {}", task.databaseId(), cycleError, e);
        }
        
        int recorded = sessionRepository.recordCycleIfActive(
            task.sessionId(), clock.instant(), SessionState.RESTING, cycleError);
        if (recorded == 0) {
            log.info("Monitoring session {} was stopped during the cycle", task.sessionId());
        }
        return true;
    }
    
    private void endLoop(SamplingTask task) {
        task.cancel();
    }
}
