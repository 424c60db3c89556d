package com.platform.dbwatch.error;

/**
 * A sampling loop is already registered for the database, or another start for it is in progress.
 */
public class MonitoringConflictException extends DbWatchException {

    private final long databaseId;
    private final Long activeSessionId;

    public MonitoringConflictException(long databaseId, long activeSessionId) {
        super(ErrorCode.MONITORING_ALREADY_ACTIVE,
            String.format("Database %d is already monitored by session %d", databaseId, activeSessionId));
        this.databaseId = databaseId;
        this.activeSessionId = activeSessionId;
    }

    public MonitoringConflictException(long databaseId) {
        super(ErrorCode.MONITORING_ALREADY_ACTIVE,
            String.format("Monitoring of database %d is already being started", databaseId));
        this.databaseId = databaseId;
        this.activeSessionId = null;
    }

    public long getDatabaseId() {
        return databaseId;
    }

    /**
     * @return the session of the running loop, or null while a concurrent start has not registered one yet
     */
    public Long getActiveSessionId() {
        return activeSessionId;
    }
}
