package com.platform.dbwatch.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA entity for one database on an instance, with its own credentials.
 */
@Entity
@Table(name = "database_connections", indexes = {
    @Index(name = "idx_dbconn_instance", columnList = "instance_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseConnectionEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String name;
    
    @Column(name = "instance_id", nullable = false)
    private Long instanceId;
    
    @Column(nullable = false)
    private String username;
    
    @ToString.Exclude
    @Column(nullable = false)
    private String password;
    
    @Column(name = "database_name", nullable = false)
    private String databaseName;
    
    @Column(name = "use_ssl", nullable = false)
    private boolean useSsl;
    
    @Column(nullable = false)
    private boolean archived;
    
    /**
     * Falls back to the instance tunnel when not enabled.
     */
    @Embedded
    @Builder.Default
    private SshTunnelSettings tunnel = new SshTunnelSettings();
}
