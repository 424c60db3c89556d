package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.error.ExtensionUnavailableException;
import com.platform.dbwatch.error.TargetExecutionException;
import com.platform.dbwatch.observation.StatementStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads cumulative statement statistics of the connected database from {@code pg_stat_statements}.
 */
@Slf4j
@Component
public class StatementStatisticsReader {
    
    static final String EXTENSION = "pg_stat_statements";
    
    static final String EXTENSION_CHECK_SQL =
        "SELECT 1 FROM pg_extension WHERE extname = 'pg_stat_statements'";
    
    static final String STATISTICS_SQL =
        "SELECT query, calls, total_exec_time, min_exec_time, max_exec_time, mean_exec_time " +
        "FROM pg_stat_statements " +
        "WHERE dbid = (SELECT oid FROM pg_database WHERE datname = current_database()) " +
        "AND query NOT LIKE '%pg_stat_statements%' " +
        "ORDER BY total_exec_time DESC LIMIT ?";
    
    // undefined_table, object_not_in_prerequisite_state (library not preloaded)
    private static final String UNDEFINED_TABLE = "42P01";
    private static final String NOT_PRELOADED = "55000";
    
    private final int sampleLimit;
    
    public StatementStatisticsReader(@Value("${dbwatch.monitoring.sample-limit:100}") int sampleLimit) {
        this.sampleLimit = sampleLimit;
    }
    
    /**
     * @throws ExtensionUnavailableException if the extension is missing or not loaded
     * @throws TargetExecutionException for any other query failure
     */
    public List<StatementStatisticsRow> read(ConnectionLease lease) {
        String label = lease.target().label();
        requireExtension(lease, label);
        
        List<StatementStatisticsRow> rows = new ArrayList<>();
        try (PreparedStatement statement = lease.connection().prepareStatement(STATISTICS_SQL)) {
            statement.setInt(1, sampleLimit);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String query = rs.getString("query");
                    if (query == null || query.isBlank()) {
                        continue;
                    }
                    rows.add(new StatementStatisticsRow(query, new StatementStatistics(
                        rs.getLong("calls"),
                        rs.getDouble("total_exec_time"),
                        nullableDouble(rs, "min_exec_time"),
                        nullableDouble(rs, "max_exec_time"),
                        nullableDouble(rs, "mean_exec_time")
                    )));
                }
            }
        } catch (SQLException e) {
            if (UNDEFINED_TABLE.equals(e.getSQLState()) || NOT_PRELOADED.equals(e.getSQLState())) {
                throw new ExtensionUnavailableException(label, EXTENSION, e);
            }
            throw new TargetExecutionException("read statement statistics", label, e);
        }
        log.debug("Read {} statement statistics rows from {}", rows.size(), label);
        return rows;
    }
    
    private void requireExtension(ConnectionLease lease, String label) {
        try (Statement statement = lease.connection().createStatement();
             ResultSet rs = statement.executeQuery(EXTENSION_CHECK_SQL)) {
            if (!rs.next()) {
                throw new ExtensionUnavailableException(label, EXTENSION);
            }
        } catch (SQLException e) {
            throw new TargetExecutionException("check " + EXTENSION + " extension", label, e);
        }
    }
    
    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
