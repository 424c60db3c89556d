package com.platform.dbwatch.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.dbwatch.healthcheck.HealthCheckDefinition;
import com.platform.dbwatch.healthcheck.HealthCheckReport;
import com.platform.dbwatch.healthcheck.HealthCheckResult;
import com.platform.dbwatch.monitoring.SessionHandle;
import com.platform.dbwatch.monitoring.SessionStatus;
import com.platform.dbwatch.observation.StatementGroupView;
import com.platform.dbwatch.observation.StatementSampleView;
import com.platform.dbwatch.persistence.entity.HealthCheckDefinitionEntity;
import com.platform.dbwatch.persistence.entity.HealthCheckExecutionEntity;
import com.platform.dbwatch.persistence.entity.HealthCheckResultEntity;
import com.platform.dbwatch.persistence.entity.MonitoringSessionEntity;
import com.platform.dbwatch.persistence.entity.StatementGroupEntity;
import com.platform.dbwatch.persistence.entity.StatementSampleEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Mappers between JPA entities and the records handed out by the services.
 */
@Slf4j
@Component
public class EntityMappers {
    
    private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    // ==================== Statements ====================
    
    public StatementSampleView toView(StatementSampleEntity entity) {
        return new StatementSampleView(
            entity.getId(),
            entity.getCanonicalStatementId(),
            entity.getRawText(),
            entity.getRawHash(),
            entity.getCalls(),
            entity.getTotalTime(),
            entity.getMinTime(),
            entity.getMaxTime(),
            entity.getMeanTime(),
            entity.getCollectedAt(),
            entity.getLastUpdatedAt()
        );
    }
    
    public StatementGroupView toView(StatementGroupEntity entity) {
        return new StatementGroupView(
            entity.getId(),
            entity.getDatabaseId(),
            entity.getName(),
            entity.getDescription(),
            entity.getCreatedBy(),
            entity.getCreatedAt()
        );
    }
    
    // ==================== Monitoring ====================
    
    public SessionHandle toHandle(MonitoringSessionEntity entity) {
        return new SessionHandle(
            entity.getId(),
            entity.getDatabaseId(),
            entity.getState(),
            entity.getIntervalSeconds(),
            entity.getScheduledEndTime(),
            entity.getStartedAt()
        );
    }
    
    public SessionStatus toStatus(MonitoringSessionEntity entity) {
        return new SessionStatus(
            entity.getId(),
            entity.getDatabaseId(),
            entity.getRequestedBy(),
            entity.isActive(),
            entity.getState(),
            entity.getIntervalSeconds(),
            entity.getLastRunAt(),
            entity.getScheduledEndTime(),
            entity.getStartedAt(),
            entity.getStoppedAt(),
            entity.getLastCycleError()
        );
    }
    
    // ==================== Health checks ====================
    
    public HealthCheckDefinition toDomain(HealthCheckDefinitionEntity entity) {
        return new HealthCheckDefinition(
            entity.getId(),
            entity.getTitle(),
            entity.getQueryText(),
            entity.getInstanceScope(),
            entity.getDatabaseScope(),
            entity.getWarningRule(),
            entity.getDisplayOrder()
        );
    }
    
    public HealthCheckResultEntity toEntity(HealthCheckResult domain) {
        return HealthCheckResultEntity.builder()
            .id(domain.id())
            .executionId(domain.executionId())
            .definitionId(domain.definitionId())
            .definitionTitle(domain.definitionTitle())
            .instanceId(domain.instanceId())
            .instanceLabel(domain.instanceLabel())
            .databaseName(domain.databaseName())
            .status(domain.status())
            .rowsJson(serializeRows(domain.rows()))
            .rowCount(domain.rowCount())
            .errorMessage(domain.errorMessage())
            .executedAt(domain.executedAt())
            .build();
    }
    
    public HealthCheckResult toDomain(HealthCheckResultEntity entity) {
        return new HealthCheckResult(
            entity.getId(),
            entity.getExecutionId(),
            entity.getDefinitionId(),
            entity.getDefinitionTitle(),
            entity.getInstanceId(),
            entity.getInstanceLabel(),
            entity.getDatabaseName(),
            entity.getStatus(),
            deserializeRows(entity.getRowsJson()),
            entity.getRowCount(),
            entity.getErrorMessage(),
            entity.getExecutedAt()
        );
    }
    
    public HealthCheckReport toReport(HealthCheckExecutionEntity execution, List<HealthCheckResultEntity> results) {
        return new HealthCheckReport(
            execution.getId(),
            execution.getClusterId(),
            execution.getRequestedBy(),
            execution.getStatus(),
            execution.getMarkdown(),
            execution.getStartedAt(),
            execution.getCompletedAt(),
            results.stream().map(this::toDomain).toList()
        );
    }
    
    String serializeRows(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} result rows", rows.size(), e);
            throw new IllegalStateException("Failed to serialize health check rows", e);
        }
    }
    
    List<Map<String, Object>> deserializeRows(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, ROWS_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize result rows", e);
            throw new IllegalStateException("Failed to deserialize health check rows", e);
        }
    }
}
