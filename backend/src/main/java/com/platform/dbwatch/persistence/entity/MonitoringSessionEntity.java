package com.platform.dbwatch.persistence.entity;

import com.platform.dbwatch.monitoring.SessionState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the monitoring record of a database.
 * One record per database, reused by every start.
 */
@Entity
@Table(name = "monitoring_sessions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_session_database", columnNames = {"database_id"})
    },
    indexes = {
        @Index(name = "idx_session_active", columnList = "active")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSessionEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "database_id", nullable = false)
    private Long databaseId;
    
    @Column(name = "requested_by")
    private String requestedBy;
    
    @Column(nullable = false)
    private boolean active;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "state", columnDefinition = "VARCHAR(20)", nullable = false)
    private SessionState state;
    
    @Column(name = "interval_seconds", nullable = false)
    private int intervalSeconds;
    
    @Column(name = "last_run_at")
    private Instant lastRunAt;
    
    /**
     * Checked at the top of every cycle; not a hard timeout.
     */
    @Column(name = "scheduled_end_time")
    private Instant scheduledEndTime;
    
    @Column(name = "started_at")
    private Instant startedAt;
    
    @Column(name = "stopped_at")
    private Instant stoppedAt;
    
    @Column(name = "last_cycle_error", columnDefinition = "TEXT")
    private String lastCycleError;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
