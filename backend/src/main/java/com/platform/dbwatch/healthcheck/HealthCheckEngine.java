package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.error.CatalogException;
import com.platform.dbwatch.error.DbWatchException;
import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.observability.LoggingConfig;
import com.platform.dbwatch.observability.MetricsRegistry;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.ClusterEntity;
import com.platform.dbwatch.persistence.entity.HealthCheckExecutionEntity;
import com.platform.dbwatch.persistence.entity.HealthCheckResultEntity;
import com.platform.dbwatch.persistence.entity.InstanceEntity;
import com.platform.dbwatch.persistence.repository.ClusterJpaRepository;
import com.platform.dbwatch.persistence.repository.HealthCheckExecutionJpaRepository;
import com.platform.dbwatch.persistence.repository.HealthCheckResultJpaRepository;
import com.platform.dbwatch.persistence.repository.InstanceJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the active health check catalog against every instance of a cluster.
 * 
 * A failure on one instance or database becomes an ERROR result for that target and
 * the run continues. Only cluster-level preconditions (unknown cluster, no instances,
 * empty catalog, writer-only checks without a writer) fail the whole execution, and
 * they are checked before any target is contacted.
 */
@Slf4j
@Service
public class HealthCheckEngine {
    
    private final ClusterJpaRepository clusterRepository;
    private final InstanceJpaRepository instanceRepository;
    private final HealthCheckExecutionJpaRepository executionRepository;
    private final HealthCheckResultJpaRepository resultRepository;
    private final HealthCheckCatalog catalog;
    private final HealthCheckTargetResolver targetResolver;
    private final HealthCheckQueryRunner queryRunner;
    private final MarkdownReportBuilder reportBuilder;
    private final EntityMappers entityMappers;
    private final MetricsRegistry metricsRegistry;
    private final TaskExecutor executor;
    private final Clock clock;
    
    public HealthCheckEngine(
            ClusterJpaRepository clusterRepository,
            InstanceJpaRepository instanceRepository,
            HealthCheckExecutionJpaRepository executionRepository,
            HealthCheckResultJpaRepository resultRepository,
            HealthCheckCatalog catalog,
            HealthCheckTargetResolver targetResolver,
            HealthCheckQueryRunner queryRunner,
            MarkdownReportBuilder reportBuilder,
            EntityMappers entityMappers,
            MetricsRegistry metricsRegistry,
            @Qualifier("healthCheckExecutor") TaskExecutor executor,
            Clock clock) {
        this.clusterRepository = clusterRepository;
        this.instanceRepository = instanceRepository;
        this.executionRepository = executionRepository;
        this.resultRepository = resultRepository;
        this.catalog = catalog;
        this.targetResolver = targetResolver;
        this.queryRunner = queryRunner;
        this.reportBuilder = reportBuilder;
        this.entityMappers = entityMappers;
        this.metricsRegistry = metricsRegistry;
        this.executor = executor;
        this.clock = clock;
    }
    
    /**
     * Record a RUNNING execution and start it in the background.
     */
    public ExecutionHandle execute(long clusterId, String requestedBy) {
        HealthCheckExecutionEntity execution = executionRepository.save(HealthCheckExecutionEntity.builder()
            .clusterId(clusterId)
            .requestedBy(requestedBy)
            .status(ExecutionStatus.RUNNING)
            .startedAt(clock.instant())
            .build());
        long executionId = execution.getId();
        log.info("Health check execution {} for cluster {} requested by {}", executionId, clusterId, requestedBy);
        
        try {
            executor.execute(() -> run(executionId));
        } catch (TaskRejectedException e) {
            log.error("Health check execution {} rejected: {}", executionId, e.getMessage());
            finish(executionId, ExecutionStatus.FAILED, "Health check could not be started: " + e.getMessage());
            return new ExecutionHandle(executionId, clusterId, ExecutionStatus.FAILED, execution.getStartedAt());
        }
        return new ExecutionHandle(executionId, clusterId, ExecutionStatus.RUNNING, execution.getStartedAt());
    }
    
    /**
     * Body of a background run. Never throws: every failure ends up on the execution record or in the log.
     */
    void run(long executionId) {
        try {
            HealthCheckExecutionEntity execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.EXECUTION_NOT_FOUND, "Execution", executionId));
            Long clusterId = execution.getClusterId();
            LoggingConfig.setExecutionContext(executionId, clusterId);

            ClusterEntity cluster = clusterRepository.findById(clusterId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.CLUSTER_NOT_FOUND, "Cluster", clusterId));
            List<InstanceEntity> instances = instanceRepository.findByClusterIdOrderByIdAsc(clusterId);
            if (instances.isEmpty()) {
                throw CatalogException.noInstances(cluster.getName());
            }
            List<HealthCheckDefinition> definitions = catalog.loadActive();
            boolean needsWriter = definitions.stream().anyMatch(HealthCheckDefinition::writerOnly);
            if (needsWriter && instances.stream().noneMatch(InstanceEntity::isWriter)) {
                throw CatalogException.noWriter(cluster.getName());
            }
            
            List<HealthCheckResult> results = runDefinitions(executionId, cluster, instances, definitions);
            String markdown = reportBuilder.build(cluster, clock.instant(), definitions, results);
            finish(executionId, ExecutionStatus.COMPLETED, markdown);
            log.info("Health check execution {} completed with {} results", executionId, results.size());
        } catch (Exception e) {
            String message = e instanceof DbWatchException ? e.getMessage() : "Unexpected error: " + e.getMessage();
            log.error("Health check execution {} failed: {}", executionId, message, e);
            try {
                finish(executionId, ExecutionStatus.FAILED, "Health check failed: " + message);
            } catch (RuntimeException finishError) {
                log.error("Could not record failure of health check execution {}: {}",
                    executionId, finishError.getMessage(), finishError);
            }
        } finally {
            LoggingConfig.clearExecutionContext();
        }
    }
    
    private List<HealthCheckResult> runDefinitions(long executionId, ClusterEntity cluster,
                                                   List<InstanceEntity> instances,
                                                   List<HealthCheckDefinition> definitions) {
        List<HealthCheckResult> results = new ArrayList<>();
        // one enumeration per instance and run, failures included
        Map<Long, DatabaseEnumeration> enumerations = new HashMap<>();
        
        for (HealthCheckDefinition definition : definitions) {
            for (InstanceEntity instance : targetResolver.instancesFor(definition, instances)) {
                String label = HealthCheckTargetResolver.label(instance);
                
                DatabaseEnumeration databases = definition.databaseScope() == DatabaseScope.ALL_USER_DATABASES
                    ? enumerations.computeIfAbsent(instance.getId(), id -> enumerate(definition, instance, cluster))
                    : new DatabaseEnumeration(targetResolver.databasesFor(definition, instance, cluster), null);
                
                if (databases.error() != null) {
                    results.add(persist(errorResult(executionId, definition, instance, label, null, databases.error())));
                    continue;
                }
                for (String database : databases.names()) {
                    results.add(persist(runOne(executionId, definition, instance, label, database)));
                }
            }
        }
        return results;
    }
    
    private DatabaseEnumeration enumerate(HealthCheckDefinition definition, InstanceEntity instance, ClusterEntity cluster) {
        try {
            return new DatabaseEnumeration(targetResolver.databasesFor(definition, instance, cluster), null);
        } catch (DbWatchException e) {
            log.warn("Could not enumerate databases on {}: {}", HealthCheckTargetResolver.label(instance), e.getMessage());
            return new DatabaseEnumeration(List.of(), e.getMessage());
        }
    }
    
    private HealthCheckResult runOne(long executionId, HealthCheckDefinition definition, InstanceEntity instance,
                                     String label, String database) {
        try {
            List<Map<String, Object>> rows = queryRunner.run(definition, targetResolver.instanceTarget(instance, database));
            ResultStatus status = definition.warningRule().flags(rows) ? ResultStatus.WARNING : ResultStatus.SUCCESS;
            return new HealthCheckResult(null, executionId, definition.id(), definition.title(), instance.getId(),
                label, database, status, rows, rows.size(), null, clock.instant());
        } catch (DbWatchException e) {
            log.warn("Check '{}' failed on {}/{}: {}", definition.title(), label, database, e.getMessage());
            return errorResult(executionId, definition, instance, label, database, e.getMessage());
        }
    }
    
    private HealthCheckResult errorResult(long executionId, HealthCheckDefinition definition, InstanceEntity instance,
                                          String label, String database, String message) {
        return new HealthCheckResult(null, executionId, definition.id(), definition.title(), instance.getId(),
            label, database, ResultStatus.ERROR, List.of(), 0, message, clock.instant());
    }
    
    private HealthCheckResult persist(HealthCheckResult result) {
        HealthCheckResultEntity saved = resultRepository.save(entityMappers.toEntity(result));
        metricsRegistry.recordHealthCheckResult(result.status().name());
        return result.withId(saved.getId());
    }
    
    private void finish(long executionId, ExecutionStatus status, String markdown) {
        executionRepository.findById(executionId).ifPresent(execution -> {
            Instant completedAt = clock.instant();
            execution.setStatus(status);
            execution.setMarkdown(markdown);
            execution.setCompletedAt(completedAt);
            executionRepository.save(execution);
            metricsRegistry.recordHealthCheckExecution(status.name(),
                Duration.between(execution.getStartedAt(), completedAt).toMillis());
        });
    }
    
    private record DatabaseEnumeration(List<String> names, String error) {
    }
}
