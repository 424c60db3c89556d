package com.platform.dbwatch.connectors.ssh;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.platform.dbwatch.connectors.TunnelDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * SSH tunnels backed by JSch local port forwarding.
 */
@Slf4j
@Component
public class JschTunnelFactory implements SshTunnelFactory {
    
    private static final String LOOPBACK = "127.0.0.1";
    
    private final int connectTimeoutMs;
    private final String strictHostKeyChecking;
    
    public JschTunnelFactory(
            @Value("${dbwatch.ssh.connect-timeout-ms:15000}") int connectTimeoutMs,
            @Value("${dbwatch.ssh.strict-host-key-checking:no}") String strictHostKeyChecking) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.strictHostKeyChecking = strictHostKeyChecking;
    }
    
    @Override
    public SshTunnel open(TunnelDescriptor tunnel, String remoteHost, int remotePort) throws JSchException {
        JSch jsch = new JSch();
        if (tunnel.hasPrivateKey()) {
            byte[] passphrase = tunnel.keyPassphrase() != null
                ? tunnel.keyPassphrase().getBytes(StandardCharsets.UTF_8)
                : null;
            jsch.addIdentity("dbwatch-" + tunnel.sshHost(),
                tunnel.privateKey().getBytes(StandardCharsets.UTF_8), null, passphrase);
        }
        
        Session session = jsch.getSession(tunnel.sshUsername(), tunnel.sshHost(), tunnel.sshPort());
        if (tunnel.sshPassword() != null && !tunnel.hasPrivateKey()) {
            session.setPassword(tunnel.sshPassword());
        }
        session.setConfig("StrictHostKeyChecking", strictHostKeyChecking);
        
        try {
            session.connect(connectTimeoutMs);
            int localPort = session.setPortForwardingL(LOOPBACK, 0, remoteHost, remotePort);
            log.info("SSH tunnel {}:{} -> {}:{} listening on {}:{}",
                tunnel.sshHost(), tunnel.sshPort(), remoteHost, remotePort, LOOPBACK, localPort);
            return new JschSshTunnel(session, localPort, tunnel.sshHost());
        } catch (JSchException e) {
            session.disconnect();
            throw e;
        }
    }
    
    static final class JschSshTunnel implements SshTunnel {
        
        private final Session session;
        private final int localPort;
        private final String jumpHost;
        
        JschSshTunnel(Session session, int localPort, String jumpHost) {
            this.session = session;
            this.localPort = localPort;
            this.jumpHost = jumpHost;
        }
        
        @Override
        public int localPort() {
            return localPort;
        }
        
        @Override
        public void close() {
            if (session.isConnected()) {
                session.disconnect();
                log.info("SSH tunnel via {} on local port {} closed", jumpHost, localPort);
            }
        }
    }
}
