package com.platform.dbwatch.monitoring;

/**
 * Lifecycle of a monitoring session.
 * STOPPED -> STARTING -> RUNNING <-> RESTING -> STOPPED
 */
public enum SessionState {
    STARTING,
    RUNNING,
    RESTING,
    STOPPED
}
