package com.platform.dbwatch.healthcheck;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one definition on one instance and database.
 * Rows keep the column order of the result set.
 */
public record HealthCheckResult(
    Long id,
    long executionId,
    long definitionId,
    String definitionTitle,
    long instanceId,
    String instanceLabel,
    String databaseName,
    ResultStatus status,
    List<Map<String, Object>> rows,
    int rowCount,
    String errorMessage,
    Instant executedAt
) {
    
    public HealthCheckResult {
        rows = rows == null ? List.of() : rows;
    }
    
    public HealthCheckResult withId(Long newId) {
        return new HealthCheckResult(newId, executionId, definitionId, definitionTitle, instanceId, instanceLabel,
            databaseName, status, rows, rowCount, errorMessage, executedAt);
    }
}
