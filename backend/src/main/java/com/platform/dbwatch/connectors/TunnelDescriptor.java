package com.platform.dbwatch.connectors;

import com.platform.dbwatch.persistence.entity.SshTunnelSettings;

/**
 * Jump host used to reach a target that is not directly routable.
 * Either a password or a private key (optionally passphrase protected) authenticates the SSH user.
 */
public record TunnelDescriptor(
    String sshHost,
    int sshPort,
    String sshUsername,
    String sshPassword,
    String privateKey,
    String keyPassphrase
) {
    
    public static final int DEFAULT_SSH_PORT = 22;
    
    /**
     * Returns null when the settings are disabled or incomplete.
     */
    public static TunnelDescriptor from(SshTunnelSettings settings) {
        if (settings == null || !settings.isUsable()) {
            return null;
        }
        return new TunnelDescriptor(
            settings.getHost(),
            settings.getPort() != null ? settings.getPort() : DEFAULT_SSH_PORT,
            settings.getUsername(),
            settings.getPassword(),
            settings.getPrivateKey(),
            settings.getKeyPassphrase()
        );
    }
    
    public boolean hasPrivateKey() {
        return privateKey != null && !privateKey.isBlank();
    }
    
    @Override
    public String toString() {
        return "TunnelDescriptor[" + sshUsername + "@" + sshHost + ":" + sshPort
            + (hasPrivateKey() ? ", key" : ", password") + "]";
    }
}
