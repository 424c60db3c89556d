package com.platform.dbwatch.connectors.ssh;

/**
 * An open local port forwarding to a remote endpoint.
 */
public interface SshTunnel extends AutoCloseable {
    
    /**
     * Local port on 127.0.0.1 that forwards to the remote endpoint.
     */
    int localPort();
    
    @Override
    void close();
}
