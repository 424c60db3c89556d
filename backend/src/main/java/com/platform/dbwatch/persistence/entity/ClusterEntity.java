package com.platform.dbwatch.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for a cluster of instances. Owned by the administrative CRUD layer.
 */
@Entity
@Table(name = "clusters")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String name;
    
    @Column(columnDefinition = "TEXT")
    private String description;
    
    /**
     * Databases skipped when a check enumerates all user databases.
     */
    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "ignored_databases", columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private List<String> ignoredDatabases = new ArrayList<>();
    
    /**
     * Databases added to the enumeration even if the catalog query does not return them.
     */
    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "extra_databases", columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private List<String> extraDatabases = new ArrayList<>();
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
