package com.platform.dbwatch.connectors;

import com.platform.dbwatch.connectors.ssh.SshTunnel;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live connection to a target plus whatever must be torn down with it.
 * 
 * Release happens exactly once no matter how often {@link #release()} or {@link #close()}
 * is called: the JDBC connection is closed first, then the tunnel.
 */
@Slf4j
public final class ConnectionLease implements AutoCloseable {
    
    private final TargetDescriptor target;
    private final Connection connection;
    private final SshTunnel tunnel;
    private final AtomicBoolean released = new AtomicBoolean(false);
    
    public ConnectionLease(TargetDescriptor target, Connection connection, SshTunnel tunnel) {
        this.target = target;
        this.connection = connection;
        this.tunnel = tunnel;
    }
    
    public Connection connection() {
        if (released.get()) {
            throw new IllegalStateException("Connection lease for " + target.label() + " already released");
        }
        return connection;
    }
    
    public TargetDescriptor target() {
        return target;
    }
    
    public boolean isReleased() {
        return released.get();
    }
    
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection to {}: {}", target.label(), e.getMessage());
        }
        if (tunnel != null) {
            tunnel.close();
        }
        log.debug("Released connection to {}", target.label());
    }
    
    @Override
    public void close() {
        release();
    }
}
