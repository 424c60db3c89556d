package com.platform.dbwatch.persistence.entity;

import com.platform.dbwatch.healthcheck.DatabaseScope;
import com.platform.dbwatch.healthcheck.InstanceScope;
import com.platform.dbwatch.healthcheck.WarningRule;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for a named diagnostic query and its target scope.
 */
@Entity
@Table(name = "health_check_definitions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_definition_title", columnNames = {"title"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckDefinitionEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String title;
    
    @Column(name = "query_text", columnDefinition = "TEXT", nullable = false)
    private String queryText;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "instance_scope", columnDefinition = "VARCHAR(20)", nullable = false)
    private InstanceScope instanceScope;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "database_scope", columnDefinition = "VARCHAR(20)", nullable = false)
    private DatabaseScope databaseScope;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "warning_rule", columnDefinition = "VARCHAR(20)", nullable = false)
    @Builder.Default
    private WarningRule warningRule = WarningRule.NONE;
    
    @Column(name = "display_order", nullable = false)
    private int displayOrder;
    
    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
