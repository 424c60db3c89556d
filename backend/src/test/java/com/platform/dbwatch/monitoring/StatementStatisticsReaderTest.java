package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.connectors.TargetDescriptor;
import com.platform.dbwatch.error.ExtensionUnavailableException;
import com.platform.dbwatch.error.TargetExecutionException;
import com.platform.dbwatch.observation.StatementStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatementStatisticsReader")
class StatementStatisticsReaderTest {
    
    private static final TargetDescriptor TARGET = new TargetDescriptor(TargetDescriptor.Kind.DATABASE, 7L,
        "pg-1.internal", 5432, "shop", "monitor", "pw", false, null);
    
    @Mock
    private Connection connection;
    
    @Mock
    private Statement checkStatement;
    
    @Mock
    private ResultSet checkResult;
    
    @Mock
    private PreparedStatement statisticsStatement;
    
    @Mock
    private ResultSet statisticsResult;
    
    private final StatementStatisticsReader reader = new StatementStatisticsReader(50);
    private ConnectionLease lease;
    
    @BeforeEach
    void setUp() throws SQLException {
        lease = new ConnectionLease(TARGET, connection, null);
        when(connection.createStatement()).thenReturn(checkStatement);
        when(checkStatement.executeQuery(StatementStatisticsReader.EXTENSION_CHECK_SQL)).thenReturn(checkResult);
    }
    
    @Test
    @DisplayName("a missing extension is reported without querying statistics")
    void missingExtension() throws SQLException {
        when(checkResult.next()).thenReturn(false);
        
        assertThatThrownBy(() -> reader.read(lease))
            .isInstanceOf(ExtensionUnavailableException.class)
            .hasMessageContaining("pg_stat_statements");
        verify(connection).createStatement();
        verifyNoMoreInteractions(connection);
    }
    
    @Test
    @DisplayName("rows are read with nullable timings and blank statements skipped")
    void readsRows() throws SQLException {
        when(checkResult.next()).thenReturn(true);
        when(connection.prepareStatement(StatementStatisticsReader.STATISTICS_SQL)).thenReturn(statisticsStatement);
        when(statisticsStatement.executeQuery()).thenReturn(statisticsResult);
        when(statisticsResult.next()).thenReturn(true, true, false);
        when(statisticsResult.getString("query")).thenReturn("  ", "SELECT * FROM orders WHERE id = $1");
        when(statisticsResult.getLong("calls")).thenReturn(12L);
        when(statisticsResult.getDouble("total_exec_time")).thenReturn(30.0);
        when(statisticsResult.getDouble("min_exec_time")).thenReturn(0.0);
        when(statisticsResult.getDouble("max_exec_time")).thenReturn(9.5);
        when(statisticsResult.getDouble("mean_exec_time")).thenReturn(2.5);
        when(statisticsResult.wasNull()).thenReturn(true, false, false);
        
        List<StatementStatisticsRow> rows = reader.read(lease);
        
        assertThat(rows).containsExactly(new StatementStatisticsRow("SELECT * FROM orders WHERE id = $1",
            new StatementStatistics(12L, 30.0, null, 9.5, 2.5)));
        verify(statisticsStatement).setInt(1, 50);
    }
    
    @Test
    @DisplayName("a library that is not preloaded counts as an unavailable extension")
    void notPreloaded() throws SQLException {
        when(checkResult.next()).thenReturn(true);
        when(connection.prepareStatement(StatementStatisticsReader.STATISTICS_SQL))
            .thenThrow(new SQLException("pg_stat_statements must be loaded via shared_preload_libraries", "55000"));
        
        assertThatThrownBy(() -> reader.read(lease)).isInstanceOf(ExtensionUnavailableException.class);
    }
    
    @Test
    @DisplayName("other query failures are target execution errors")
    void otherFailure() throws SQLException {
        when(checkResult.next()).thenReturn(true);
        when(connection.prepareStatement(StatementStatisticsReader.STATISTICS_SQL))
            .thenThrow(new SQLException("permission denied", "42501"));
        
        assertThatThrownBy(() -> reader.read(lease)).isInstanceOf(TargetExecutionException.class);
    }
}
