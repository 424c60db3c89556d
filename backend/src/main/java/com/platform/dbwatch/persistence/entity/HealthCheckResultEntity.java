package com.platform.dbwatch.persistence.entity;

import com.platform.dbwatch.healthcheck.ResultStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the outcome of one check on one instance/database.
 * Append-only.
 */
@Entity
@Table(name = "health_check_results", indexes = {
    @Index(name = "idx_result_execution", columnList = "execution_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckResultEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "execution_id", nullable = false)
    private Long executionId;
    
    @Column(name = "definition_id", nullable = false)
    private Long definitionId;
    
    @Column(name = "definition_title", nullable = false)
    private String definitionTitle;
    
    @Column(name = "instance_id", nullable = false)
    private Long instanceId;
    
    @Column(name = "instance_label", nullable = false)
    private String instanceLabel;
    
    @Column(name = "database_name")
    private String databaseName;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private ResultStatus status;
    
    @Column(name = "rows_json", columnDefinition = "TEXT")
    private String rowsJson;
    
    @Column(name = "row_count", nullable = false)
    private int rowCount;
    
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
    
    @Column(name = "executed_at", nullable = false, updatable = false)
    private Instant executedAt;
}
