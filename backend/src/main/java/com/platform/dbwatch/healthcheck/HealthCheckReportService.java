package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.HealthCheckExecutionEntity;
import com.platform.dbwatch.persistence.repository.HealthCheckExecutionJpaRepository;
import com.platform.dbwatch.persistence.repository.HealthCheckResultJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side of health check executions.
 */
@Service
@RequiredArgsConstructor
public class HealthCheckReportService {
    
    private final HealthCheckExecutionJpaRepository executionRepository;
    private final HealthCheckResultJpaRepository resultRepository;
    private final EntityMappers entityMappers;
    
    @Transactional(readOnly = true)
    public HealthCheckReport getExecution(long executionId) {
        HealthCheckExecutionEntity execution = executionRepository.findById(executionId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.EXECUTION_NOT_FOUND, "Execution", executionId));
        return entityMappers.toReport(execution, resultRepository.findByExecutionIdOrderByIdAsc(executionId));
    }
    
    /**
     * Executions of a cluster, newest first, without their results.
     */
    @Transactional(readOnly = true)
    public List<HealthCheckReport> listExecutions(long clusterId) {
        return executionRepository.findByClusterIdOrderByStartedAtDesc(clusterId).stream()
            .map(execution -> entityMappers.toReport(execution, List.of()))
            .toList();
    }
}
