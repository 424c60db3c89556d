package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.persistence.entity.HealthCheckDefinitionEntity;
import com.platform.dbwatch.persistence.repository.HealthCheckDefinitionJpaRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration class that seeds the built-in PostgreSQL health checks.
 * Only titles not yet present are inserted, so edited or deactivated checks stay as they are.
 */
@Slf4j
@Configuration
public class DefaultHealthChecksConfig {
    
    private final HealthCheckDefinitionJpaRepository definitionRepository;
    private final boolean seedDefaults;
    
    public DefaultHealthChecksConfig(
            HealthCheckDefinitionJpaRepository definitionRepository,
            @Value("${dbwatch.healthcheck.seed-defaults:true}") boolean seedDefaults) {
        this.definitionRepository = definitionRepository;
        this.seedDefaults = seedDefaults;
    }
    
    @PostConstruct
    public void initializeDefaultChecks() {
        if (!seedDefaults) {
            log.info("Default health check seeding disabled");
            return;
        }
        log.info("Initializing default health checks...");
        
        int created = 0;
        for (HealthCheckDefinitionEntity definition : defaultChecks()) {
            if (definitionRepository.findByTitle(definition.getTitle()).isPresent()) {
                continue;
            }
            definitionRepository.save(definition);
            created++;
        }
        
        log.info("Default health checks initialized: {} created, {} already present",
            created, defaultChecks().size() - created);
    }
    
    static List<HealthCheckDefinitionEntity> defaultChecks() {
        // Check 1: databases approaching transaction id wraparound
        HealthCheckDefinitionEntity wraparound = HealthCheckDefinitionEntity.builder()
            .title("Transaction ID wraparound risk")
            .queryText("SELECT datname, age(datfrozenxid) AS xid_age, " +
                "round(100.0 * age(datfrozenxid) / 2147483647, 2) AS pct_towards_wraparound " +
                "FROM pg_database WHERE age(datfrozenxid) > 1000000000 ORDER BY age(datfrozenxid) DESC")
            .instanceScope(InstanceScope.WRITER_ONLY)
            .databaseScope(DatabaseScope.SINGLE_DATABASE)
            .warningRule(WarningRule.ANY_ROWS)
            .displayOrder(10)
            .build();
        
        // Check 2: replicas attached to the writer and their lag
        HealthCheckDefinitionEntity replication = HealthCheckDefinitionEntity.builder()
            .title("Replication status")
            .queryText("SELECT application_name, client_addr::text AS client_addr, state, sync_state, " +
                "write_lag::text AS write_lag, flush_lag::text AS flush_lag, replay_lag::text AS replay_lag " +
                "FROM pg_stat_replication ORDER BY application_name")
            .instanceScope(InstanceScope.WRITER_ONLY)
            .databaseScope(DatabaseScope.SINGLE_DATABASE)
            .warningRule(WarningRule.NONE)
            .displayOrder(20)
            .build();
        
        // Check 3: statements running for more than five minutes
        HealthCheckDefinitionEntity longRunning = HealthCheckDefinitionEntity.builder()
            .title("Long running queries")
            .queryText("SELECT pid, usename, datname, state, " +
                "(now() - query_start)::text AS running_for, left(query, 200) AS query " +
                "FROM pg_stat_activity WHERE state <> 'idle' AND pid <> pg_backend_pid() " +
                "AND query_start < now() - interval '5 minutes' ORDER BY query_start")
            .instanceScope(InstanceScope.ALL_INSTANCES)
            .databaseScope(DatabaseScope.SINGLE_DATABASE)
            .warningRule(WarningRule.ANY_ROWS)
            .displayOrder(30)
            .build();
        
        // Check 4: sessions waiting on a lock held by another session
        HealthCheckDefinitionEntity blocked = HealthCheckDefinitionEntity.builder()
            .title("Blocked sessions")
            .queryText("SELECT blocked.pid AS blocked_pid, blocked.usename AS blocked_user, " +
                "blocking.pid AS blocking_pid, blocking.usename AS blocking_user, " +
                "left(blocked.query, 200) AS blocked_query " +
                "FROM pg_stat_activity blocked " +
                "JOIN pg_stat_activity blocking ON blocking.pid = ANY(pg_blocking_pids(blocked.pid)) " +
                "ORDER BY blocked.pid")
            .instanceScope(InstanceScope.ALL_INSTANCES)
            .databaseScope(DatabaseScope.SINGLE_DATABASE)
            .warningRule(WarningRule.ANY_ROWS)
            .displayOrder(40)
            .build();
        
        // Check 5: indexes left invalid by a failed concurrent build
        HealthCheckDefinitionEntity invalidIndexes = HealthCheckDefinitionEntity.builder()
            .title("Invalid indexes")
            .queryText("SELECT n.nspname AS schema_name, c.relname AS index_name " +
                "FROM pg_index i JOIN pg_class c ON c.oid = i.indexrelid " +
                "JOIN pg_namespace n ON n.oid = c.relnamespace " +
                "WHERE NOT i.indisvalid ORDER BY n.nspname, c.relname")
            .instanceScope(InstanceScope.WRITER_ONLY)
            .databaseScope(DatabaseScope.ALL_USER_DATABASES)
            .warningRule(WarningRule.ANY_ROWS)
            .displayOrder(50)
            .build();
        
        // Check 6: tables with a large share of dead tuples
        HealthCheckDefinitionEntity deadTuples = HealthCheckDefinitionEntity.builder()
            .title("Dead tuple bloat")
            .queryText("SELECT schemaname, relname, n_live_tup, n_dead_tup, " +
                "round(100.0 * n_dead_tup / NULLIF(n_live_tup + n_dead_tup, 0), 2) AS dead_pct, " +
                "last_autovacuum FROM pg_stat_user_tables " +
                "WHERE n_dead_tup > 10000 AND n_dead_tup > n_live_tup * 0.2 " +
                "ORDER BY n_dead_tup DESC LIMIT 20")
            .instanceScope(InstanceScope.WRITER_ONLY)
            .databaseScope(DatabaseScope.ALL_USER_DATABASES)
            .warningRule(WarningRule.ANY_ROWS)
            .displayOrder(60)
            .build();
        
        // Check 7: connections in use against max_connections
        HealthCheckDefinitionEntity connectionUsage = HealthCheckDefinitionEntity.builder()
            .title("Connection usage")
            .queryText("SELECT count(*) AS connections, " +
                "current_setting('max_connections')::int AS max_connections, " +
                "round(100.0 * count(*) / current_setting('max_connections')::int, 2) AS pct_used " +
                "FROM pg_stat_activity")
            .instanceScope(InstanceScope.ALL_INSTANCES)
            .databaseScope(DatabaseScope.SINGLE_DATABASE)
            .warningRule(WarningRule.NONE)
            .displayOrder(70)
            .build();
        
        // Check 8: size of every database
        HealthCheckDefinitionEntity databaseSizes = HealthCheckDefinitionEntity.builder()
            .title("Database sizes")
            .queryText("SELECT datname, pg_size_pretty(pg_database_size(datname)) AS size " +
                "FROM pg_database WHERE NOT datistemplate ORDER BY pg_database_size(datname) DESC")
            .instanceScope(InstanceScope.WRITER_ONLY)
            .databaseScope(DatabaseScope.SINGLE_DATABASE)
            .warningRule(WarningRule.NONE)
            .displayOrder(80)
            .build();
        
        return List.of(wraparound, replication, longRunning, blocked, invalidIndexes,
            deadTuples, connectionUsage, databaseSizes);
    }
}
