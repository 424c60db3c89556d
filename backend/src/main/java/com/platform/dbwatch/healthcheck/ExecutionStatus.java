package com.platform.dbwatch.healthcheck;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
