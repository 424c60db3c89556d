package com.platform.dbwatch.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for one concrete statement text and the statistics last read for it.
 * Times are in milliseconds.
 */
@Entity
@Table(name = "statement_samples",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_sample_canonical_hash", columnNames = {"canonical_statement_id", "raw_hash"})
    },
    indexes = {
        @Index(name = "idx_sample_database", columnList = "database_id"),
        @Index(name = "idx_sample_updated", columnList = "last_updated_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementSampleEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "canonical_statement_id", nullable = false)
    private Long canonicalStatementId;
    
    @Column(name = "database_id", nullable = false)
    private Long databaseId;
    
    @Column(name = "raw_text", columnDefinition = "TEXT", nullable = false)
    private String rawText;
    
    @Column(name = "raw_hash", length = 32, nullable = false)
    private String rawHash;
    
    @Column(nullable = false)
    private long calls;
    
    @Column(name = "total_time", nullable = false)
    private double totalTime;
    
    @Column(name = "min_time")
    private Double minTime;
    
    @Column(name = "max_time")
    private Double maxTime;
    
    @Column(name = "mean_time")
    private Double meanTime;
    
    @Column(name = "collected_at", nullable = false, updatable = false)
    private Instant collectedAt;
    
    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;
}
