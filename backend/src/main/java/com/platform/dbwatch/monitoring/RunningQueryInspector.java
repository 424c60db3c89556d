package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.connectors.ConnectionProvider;
import com.platform.dbwatch.connectors.TargetDescriptor;
import com.platform.dbwatch.connectors.TargetResolver;
import com.platform.dbwatch.error.TargetExecutionException;
import com.platform.dbwatch.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Live view of what a monitored database is executing right now, and the means to end a backend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunningQueryInspector {
    
    static final String RUNNING_QUERIES_SQL =
        "SELECT pid, usename, application_name, client_addr::text AS client_addr, state, wait_event_type, " +
        "query_start, EXTRACT(EPOCH FROM (now() - query_start)) AS duration_seconds, query " +
        "FROM pg_stat_activity " +
        "WHERE datname = current_database() AND pid <> pg_backend_pid() " +
        "AND state IS NOT NULL AND state <> 'idle' " +
        "ORDER BY query_start ASC NULLS LAST";
    
    static final String TERMINATE_SQL = "SELECT pg_terminate_backend(?)";
    
    private final TargetResolver targetResolver;
    private final ConnectionProvider connectionProvider;
    
    public List<RunningQuery> listRunningQueries(long databaseId) {
        TargetDescriptor target = targetResolver.forDatabase(databaseId);
        try (ConnectionLease lease = connectionProvider.resolve(target);
             PreparedStatement statement = lease.connection().prepareStatement(RUNNING_QUERIES_SQL);
             ResultSet rs = statement.executeQuery()) {
            List<RunningQuery> queries = new ArrayList<>();
            while (rs.next()) {
                Timestamp queryStart = rs.getTimestamp("query_start");
                double duration = rs.getDouble("duration_seconds");
                Double durationSeconds = rs.wasNull() ? null : duration;
                queries.add(new RunningQuery(
                    rs.getInt("pid"),
                    rs.getString("usename"),
                    rs.getString("application_name"),
                    rs.getString("client_addr"),
                    rs.getString("state"),
                    rs.getString("wait_event_type"),
                    queryStart != null ? queryStart.toInstant() : null,
                    durationSeconds,
                    rs.getString("query")
                ));
            }
            return queries;
        } catch (SQLException e) {
            throw new TargetExecutionException("list running queries", target.label(), e);
        }
    }
    
    /**
     * Terminate a backend on the database.
     * @return false when no such backend existed or it could not be signalled
     */
    public boolean terminateBackend(long databaseId, int pid) {
        if (pid <= 0) {
            throw new ValidationException("pid", pid, "must be positive");
        }
        TargetDescriptor target = targetResolver.forDatabase(databaseId);
        try (ConnectionLease lease = connectionProvider.resolve(target);
             PreparedStatement statement = lease.connection().prepareStatement(TERMINATE_SQL)) {
            statement.setInt(1, pid);
            try (ResultSet rs = statement.executeQuery()) {
                boolean terminated = rs.next() && rs.getBoolean(1);
                log.warn("Termination of backend {} on {} requested: terminated={}", pid, target.label(), terminated);
                return terminated;
            }
        } catch (SQLException e) {
            throw new TargetExecutionException("terminate backend " + pid, target.label(), e);
        }
    }
}
