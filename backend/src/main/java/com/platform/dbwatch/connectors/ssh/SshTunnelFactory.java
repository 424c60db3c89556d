package com.platform.dbwatch.connectors.ssh;

import com.platform.dbwatch.connectors.TunnelDescriptor;

/**
 * Opens SSH tunnels to database endpoints.
 */
public interface SshTunnelFactory {
    
    /**
     * Connect to the jump host and forward an ephemeral local port to remoteHost:remotePort.
     */
    SshTunnel open(TunnelDescriptor tunnel, String remoteHost, int remotePort) throws Exception;
}
