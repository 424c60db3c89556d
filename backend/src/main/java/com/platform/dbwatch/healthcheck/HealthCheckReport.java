package com.platform.dbwatch.healthcheck;

import java.time.Instant;
import java.util.List;

/**
 * A stored health check run with its markdown body and structured results.
 */
public record HealthCheckReport(
    long executionId,
    long clusterId,
    String requestedBy,
    ExecutionStatus status,
    String markdown,
    Instant startedAt,
    Instant completedAt,
    List<HealthCheckResult> results
) {
    
    public long countByStatus(ResultStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
