package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.connectors.ConnectionProvider;
import com.platform.dbwatch.connectors.TargetDescriptor;
import com.platform.dbwatch.error.TargetExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one definition's query on one target with a timeout and a row cap.
 */
@Slf4j
@Component
public class HealthCheckQueryRunner {
    
    private final ConnectionProvider connectionProvider;
    private final int maxRows;
    private final int statementTimeoutSeconds;
    
    public HealthCheckQueryRunner(
            ConnectionProvider connectionProvider,
            @Value("${dbwatch.healthcheck.max-rows:500}") int maxRows,
            @Value("${dbwatch.healthcheck.statement-timeout-seconds:30}") int statementTimeoutSeconds) {
        this.connectionProvider = connectionProvider;
        this.maxRows = maxRows;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }
    
    /**
     * @return rows as column-label to value maps, in result set order
     * @throws com.platform.dbwatch.error.ConnectionException if the target cannot be reached
     * @throws TargetExecutionException if the query fails
     */
    public List<Map<String, Object>> run(HealthCheckDefinition definition, TargetDescriptor target) {
        try (ConnectionLease lease = connectionProvider.resolve(target)) {
            Connection connection = lease.connection();
            connection.setReadOnly(true);
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(statementTimeoutSeconds);
                statement.setMaxRows(maxRows);
                try (ResultSet rs = statement.executeQuery(definition.queryText())) {
                    List<Map<String, Object>> rows = readRows(rs);
                    log.debug("Check '{}' returned {} rows on {}", definition.title(), rows.size(), target.label());
                    return rows;
                }
            }
        } catch (SQLException e) {
            throw new TargetExecutionException(definition.title(), target.label(), e);
        }
    }
    
    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columns = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next() && rows.size() < maxRows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                row.put(metaData.getColumnLabel(i), toPlainValue(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }
    
    /**
     * Keeps JSON-friendly values; timestamps become ISO-8601 strings and anything else its text form.
     */
    static Object toPlainValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        return String.valueOf(value);
    }
}
