package com.platform.dbwatch.connectors.postgres;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens raw JDBC connections. Kept as a seam so connection routing can be tested without a server.
 */
@FunctionalInterface
public interface JdbcConnector {
    
    Connection connect(String jdbcUrl, Properties properties) throws SQLException;
}
