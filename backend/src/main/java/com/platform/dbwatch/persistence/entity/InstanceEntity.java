package com.platform.dbwatch.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA entity for a database server belonging to a cluster.
 * At most one instance per cluster carries the writer flag; the CRUD layer enforces it.
 */
@Entity
@Table(name = "instances", indexes = {
    @Index(name = "idx_instance_cluster", columnList = "cluster_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstanceEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String hostname;
    
    @Column(nullable = false)
    private int port;
    
    @Column(nullable = false)
    private String username;
    
    @ToString.Exclude
    @Column(nullable = false)
    private String password;
    
    @Column(columnDefinition = "TEXT")
    private String description;
    
    @Column(name = "is_writer", nullable = false)
    private boolean writer;
    
    @Column(name = "default_database_name")
    private String defaultDatabaseName;
    
    @Column(name = "cluster_id", nullable = false)
    private Long clusterId;
    
    @Embedded
    @Builder.Default
    private SshTunnelSettings tunnel = new SshTunnelSettings();
}
