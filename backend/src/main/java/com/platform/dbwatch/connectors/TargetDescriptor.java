package com.platform.dbwatch.connectors;

import com.platform.dbwatch.persistence.entity.DatabaseConnectionEntity;
import com.platform.dbwatch.persistence.entity.InstanceEntity;


/**
 * Everything needed to open a connection to an instance or to one database on it.
 * The tunnel is optional; when present the connection is routed through it.
 */
public record TargetDescriptor(
    Kind kind,
    long id,
    String host,
    int port,
    String databaseName,
    String username,
    String password,
    boolean useSsl,
    TunnelDescriptor tunnel
) {
    
    public enum Kind {
        INSTANCE,
        DATABASE
    }
    
    public static TargetDescriptor forInstance(InstanceEntity instance, String databaseName) {
        return new TargetDescriptor(
            Kind.INSTANCE,
            instance.getId(),
            instance.getHostname(),
            instance.getPort(),
            databaseName,
            instance.getUsername(),
            instance.getPassword(),
            false,
            TunnelDescriptor.from(instance.getTunnel())
        );
    }
    
    /**
     * A database uses its own tunnel settings when enabled, otherwise its instance's.
     */
    public static TargetDescriptor forDatabase(DatabaseConnectionEntity database, InstanceEntity instance) {
        TunnelDescriptor tunnel = TunnelDescriptor.from(database.getTunnel());
        if (tunnel == null) {
            tunnel = TunnelDescriptor.from(instance.getTunnel());
        }
        return new TargetDescriptor(
            Kind.DATABASE,
            database.getId(),
            instance.getHostname(),
            instance.getPort(),
            database.getDatabaseName(),
            database.getUsername(),
            database.getPassword(),
            database.isUseSsl(),
            tunnel
        );
    }
    
    public boolean tunneled() {
        return tunnel != null;
    }
    
    /**
     * Identity used in logs, errors and reports. Never contains credentials.
     */
    public String label() {
        return String.format("%s %d (%s:%d/%s%s)", kind.name().toLowerCase(), id, host, port,
            databaseName, tunneled() ? " via " + tunnel.sshHost() : "");
    }
    
    @Override
    public String toString() {
        return "TargetDescriptor[" + label() + ", user=" + username + "]";
    }
}
