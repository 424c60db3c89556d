package com.platform.dbwatch.connectors.postgres;

import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Unpooled connections through the PostgreSQL driver. Every lease opens and closes its own.
 */
@Component
public class DriverManagerJdbcConnector implements JdbcConnector {
    
    @Override
    public Connection connect(String jdbcUrl, Properties properties) throws SQLException {
        return DriverManager.getConnection(jdbcUrl, properties);
    }
}
