package com.platform.dbwatch.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the deduplicated shape of a statement on one database.
 */
@Entity
@Table(name = "canonical_statements",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_canonical_db_hash", columnNames = {"database_id", "canonical_hash"})
    },
    indexes = {
        @Index(name = "idx_canonical_last_seen", columnList = "last_seen_at"),
        @Index(name = "idx_canonical_group", columnList = "group_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalStatementEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "database_id", nullable = false)
    private Long databaseId;
    
    @Column(name = "canonical_text", columnDefinition = "TEXT", nullable = false)
    private String canonicalText;
    
    @Column(name = "canonical_hash", length = 32, nullable = false)
    private String canonicalHash;
    
    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;
    
    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;
    
    @Column(name = "is_known", nullable = false)
    private boolean known;
    
    @Column(name = "group_id")
    private Long groupId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
