package com.platform.dbwatch.persistence.entity;

import com.platform.dbwatch.healthcheck.ExecutionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for one health check run against a cluster, including its markdown report.
 */
@Entity
@Table(name = "health_check_executions", indexes = {
    @Index(name = "idx_execution_cluster", columnList = "cluster_id"),
    @Index(name = "idx_execution_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckExecutionEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "cluster_id", nullable = false)
    private Long clusterId;
    
    @Column(name = "requested_by")
    private String requestedBy;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private ExecutionStatus status;
    
    @Column(columnDefinition = "TEXT")
    private String markdown;
    
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
}
