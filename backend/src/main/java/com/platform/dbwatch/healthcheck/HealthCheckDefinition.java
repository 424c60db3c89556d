package com.platform.dbwatch.healthcheck;

/**
 * A diagnostic query and where it runs. The engine treats the query text as opaque.
 */
public record HealthCheckDefinition(
    long id,
    String title,
    String queryText,
    InstanceScope instanceScope,
    DatabaseScope databaseScope,
    WarningRule warningRule,
    int displayOrder
) {
    
    public boolean writerOnly() {
        return instanceScope == InstanceScope.WRITER_ONLY;
    }
}
