package com.platform.dbwatch.connectors;

import com.platform.dbwatch.connectors.postgres.JdbcConnector;
import com.platform.dbwatch.connectors.ssh.SshTunnel;
import com.platform.dbwatch.connectors.ssh.SshTunnelFactory;
import com.platform.dbwatch.error.ConnectionException;
import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.TargetExecutionException;
import com.platform.dbwatch.observability.MetricsRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * PostgreSQL connection provider for direct and SSH-tunneled targets.
 * 
 * Both paths share one flow: open the tunnel if the descriptor has one, connect JDBC
 * to the tunnel's local port or to the target itself, and hand both to a lease that
 * tears them down together. A failed connect closes the tunnel before the error leaves.
 */
@Slf4j
@Component
public class TunnelingConnectionProvider implements ConnectionProvider {
    
    private static final String LOOPBACK = "127.0.0.1";
    private static final String CONNECTION_EXCEPTION_CLASS = "08";
    
    private static final String USER_DATABASES_SQL =
        "SELECT datname FROM pg_database WHERE datistemplate = false AND datallowconn = true";
    
    private final JdbcConnector jdbcConnector;
    private final SshTunnelFactory tunnelFactory;
    private final MetricsRegistry metricsRegistry;
    private final Retry connectRetry;
    private final int connectTimeoutSeconds;
    private final int socketTimeoutSeconds;
    private final String applicationName;
    private final List<String> excludedDatabases;
    
    public TunnelingConnectionProvider(
            JdbcConnector jdbcConnector,
            SshTunnelFactory tunnelFactory,
            MetricsRegistry metricsRegistry,
            @Value("${dbwatch.connection.connect-timeout-seconds:10}") int connectTimeoutSeconds,
            @Value("${dbwatch.connection.socket-timeout-seconds:60}") int socketTimeoutSeconds,
            @Value("${dbwatch.connection.application-name:dbwatch}") String applicationName,
            @Value("${dbwatch.connection.retry.max-attempts:2}") int maxAttempts,
            @Value("${dbwatch.connection.retry.wait-ms:500}") long retryWaitMs,
            @Value("${dbwatch.connection.excluded-databases:postgres,rdsadmin,azure_maintenance,azure_sys,cloudsqladmin}")
            List<String> excludedDatabases) {
        this.jdbcConnector = jdbcConnector;
        this.tunnelFactory = tunnelFactory;
        this.metricsRegistry = metricsRegistry;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.socketTimeoutSeconds = socketTimeoutSeconds;
        this.applicationName = applicationName;
        this.excludedDatabases = List.copyOf(excludedDatabases);
        this.connectRetry = Retry.of("target-connect", RetryConfig.custom()
            .maxAttempts(Math.max(1, maxAttempts))
            .waitDuration(Duration.ofMillis(Math.max(1, retryWaitMs)))
            .retryOnException(TunnelingConnectionProvider::isTransientConnectFailure)
            .build());
        this.connectRetry.getEventPublisher().onRetry(event ->
            log.warn("Retrying connection (attempt {}): {}", event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }
    
    @Override
    public ConnectionLease resolve(TargetDescriptor target) {
        long startTime = System.currentTimeMillis();
        String kind = target.kind().name().toLowerCase();
        
        SshTunnel tunnel = null;
        String host = target.host();
        int port = target.port();
        
        if (target.tunneled()) {
            try {
                tunnel = tunnelFactory.open(target.tunnel(), target.host(), target.port());
            } catch (Exception e) {
                log.error("SSH tunnel to {} failed: {}", target.label(), e.getMessage());
                metricsRegistry.recordConnectionFailure(kind, ErrorCode.TUNNEL_FAILED.getCode());
                throw ConnectionException.tunnelFailed(target.label(), e);
            }
            host = LOOPBACK;
            port = tunnel.localPort();
        }
        
        String jdbcUrl = String.format("jdbc:postgresql://%s:%d/%s", host, port, target.databaseName());
        Properties properties = connectionProperties(target);
        
        try {
            Connection connection = connectRetry.executeCallable(() -> jdbcConnector.connect(jdbcUrl, properties));
            long latency = System.currentTimeMillis() - startTime;
            metricsRegistry.recordConnectionSuccess(kind, latency);
            log.debug("Connected to {} in {}ms", target.label(), latency);
            return new ConnectionLease(target, connection, tunnel);
        } catch (Exception e) {
            if (tunnel != null) {
                tunnel.close();
            }
            ErrorCode errorCode = classify(e);
            metricsRegistry.recordConnectionFailure(kind, errorCode.getCode());
            log.error("Connection to {} failed [{}]: {}", target.label(), errorCode.getCode(), e.getMessage());
            throw ConnectionException.connectFailed(errorCode, target.label(), e);
        }
    }
    
    @Override
    public List<String> listUserDatabases(ConnectionLease lease) {
        StringBuilder sql = new StringBuilder(USER_DATABASES_SQL);
        if (!excludedDatabases.isEmpty()) {
            sql.append(" AND datname NOT IN (")
                .append(String.join(", ", Collections.nCopies(excludedDatabases.size(), "?")))
                .append(")");
        }
        sql.append(" ORDER BY datname");
        
        try (PreparedStatement statement = lease.connection().prepareStatement(sql.toString())) {
            for (int i = 0; i < excludedDatabases.size(); i++) {
                statement.setString(i + 1, excludedDatabases.get(i));
            }
            List<String> names = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        } catch (SQLException e) {
            throw new TargetExecutionException("list user databases", lease.target().label(), e);
        }
    }
    
    private Properties connectionProperties(TargetDescriptor target) {
        Properties properties = new Properties();
        properties.setProperty("user", target.username());
        if (target.password() != null) {
            properties.setProperty("password", target.password());
        }
        properties.setProperty("connectTimeout", String.valueOf(connectTimeoutSeconds));
        properties.setProperty("socketTimeout", String.valueOf(socketTimeoutSeconds));
        properties.setProperty("ApplicationName", applicationName);
        if (target.useSsl()) {
            properties.setProperty("sslmode", "require");
        }
        return properties;
    }
    
    static boolean isTransientConnectFailure(Throwable e) {
        return e instanceof SQLException sqlException
            && sqlException.getSQLState() != null
            && sqlException.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS);
    }
    
    static ErrorCode classify(Throwable e) {
        if (e instanceof SQLTimeoutException || e.getCause() instanceof SocketTimeoutException) {
            return ErrorCode.CONNECTION_TIMEOUT;
        }
        if (e instanceof SQLException sqlException && sqlException.getSQLState() != null
                && sqlException.getSQLState().startsWith("28")) {
            return ErrorCode.AUTHENTICATION_FAILED;
        }
        return ErrorCode.CONNECTION_FAILED;
    }
}
