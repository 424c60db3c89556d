package com.platform.dbwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * dbwatch: query observability for PostgreSQL clusters.
 * 
 * Features:
 * - Periodic sampling of pg_stat_statements into canonical statements
 * - Manual triage of statements (known flag, groups)
 * - Cluster-wide health checks with markdown reports
 * - Optional SSH tunnelling to every target
 */
@SpringBootApplication
public class DbWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbWatchApplication.class, args);
    }
}
