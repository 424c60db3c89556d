package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.connectors.ConnectionProvider;
import com.platform.dbwatch.connectors.TargetDescriptor;
import com.platform.dbwatch.connectors.TargetResolver;
import com.platform.dbwatch.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RunningQueryInspector")
class RunningQueryInspectorTest {
    
    private static final TargetDescriptor TARGET = new TargetDescriptor(TargetDescriptor.Kind.DATABASE, 7L,
        "pg-1.internal", 5432, "shop", "monitor", "pw", false, null);
    
    @Mock
    private TargetResolver targetResolver;
    
    @Mock
    private ConnectionProvider connectionProvider;
    
    @Mock
    private Connection connection;
    
    @Mock
    private PreparedStatement statement;
    
    @Mock
    private ResultSet resultSet;
    
    @InjectMocks
    private RunningQueryInspector inspector;
    
    @Test
    @DisplayName("non-positive pids are rejected before connecting")
    void rejectsInvalidPid() {
        assertThatThrownBy(() -> inspector.terminateBackend(7L, 0)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(targetResolver, connectionProvider);
    }
    
    @Test
    @DisplayName("terminating a backend reports whether it was signalled")
    void terminatesBackend() throws SQLException {
        connect(RunningQueryInspector.TERMINATE_SQL);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getBoolean(1)).thenReturn(true);
        
        assertThat(inspector.terminateBackend(7L, 4242)).isTrue();
        verify(statement).setInt(1, 4242);
        verify(connection).close();
    }
    
    @Test
    @DisplayName("running queries are listed with an absent duration kept as null")
    void listsRunningQueries() throws SQLException {
        connect(RunningQueryInspector.RUNNING_QUERIES_SQL);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getTimestamp("query_start")).thenReturn(Timestamp.from(Instant.parse("2024-05-01T11:59:00Z")));
        when(resultSet.getDouble("duration_seconds")).thenReturn(0.0);
        when(resultSet.wasNull()).thenReturn(true);
        when(resultSet.getInt("pid")).thenReturn(4242);
        when(resultSet.getString("usename")).thenReturn("app");
        when(resultSet.getString("application_name")).thenReturn("checkout");
        when(resultSet.getString("client_addr")).thenReturn("10.0.0.8/32");
        when(resultSet.getString("state")).thenReturn("active");
        when(resultSet.getString("wait_event_type")).thenReturn(null);
        when(resultSet.getString("query")).thenReturn("SELECT pg_sleep(60)");
        
        List<RunningQuery> queries = inspector.listRunningQueries(7L);
        
        assertThat(queries).singleElement().satisfies(q -> {
            assertThat(q.pid()).isEqualTo(4242);
            assertThat(q.queryStart()).isEqualTo(Instant.parse("2024-05-01T11:59:00Z"));
            assertThat(q.durationSeconds()).isNull();
            assertThat(q.query()).isEqualTo("SELECT pg_sleep(60)");
        });
    }
    
    private void connect(String sql) throws SQLException {
        when(targetResolver.forDatabase(7L)).thenReturn(TARGET);
        when(connectionProvider.resolve(TARGET)).thenReturn(new ConnectionLease(TARGET, connection, null));
        when(connection.prepareStatement(sql)).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
    }
}
