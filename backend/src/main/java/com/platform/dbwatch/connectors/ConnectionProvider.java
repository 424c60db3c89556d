package com.platform.dbwatch.connectors;

import java.util.List;

/**
 * Resolves target descriptors into ready-to-query connections.
 * Implementations route through an SSH tunnel when the descriptor carries one.
 */
public interface ConnectionProvider {
    
    /**
     * Open a connection to the target.
     * The caller must release the lease on every exit path, ideally with try-with-resources.
     * @throws com.platform.dbwatch.error.ConnectionException if the tunnel or the connection fails
     */
    ConnectionLease resolve(TargetDescriptor target);
    
    /**
     * Names of the non-template, non-system databases on the lease's instance.
     * @throws com.platform.dbwatch.error.TargetExecutionException if the catalog query fails
     */
    List<String> listUserDatabases(ConnectionLease lease);
}
