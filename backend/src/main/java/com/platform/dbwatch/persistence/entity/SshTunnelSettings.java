package com.platform.dbwatch.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * SSH jump host settings shared by instances and database connections.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SshTunnelSettings {
    
    @Column(name = "use_ssh_tunnel", nullable = false)
    private boolean enabled;
    
    @Column(name = "ssh_host")
    private String host;
    
    @Column(name = "ssh_port")
    @Builder.Default
    private Integer port = 22;
    
    @Column(name = "ssh_username")
    private String username;
    
    @ToString.Exclude
    @Column(name = "ssh_password")
    private String password;
    
    @ToString.Exclude
    @Column(name = "ssh_private_key", columnDefinition = "TEXT")
    private String privateKey;
    
    @ToString.Exclude
    @Column(name = "ssh_key_passphrase")
    private String keyPassphrase;
    
    public boolean isUsable() {
        return enabled && host != null && !host.isBlank() && username != null && !username.isBlank();
    }
}
