package com.platform.dbwatch.monitoring;

import java.time.Instant;

/**
 * A backend of the target database that is currently doing work.
 */
public record RunningQuery(
    int pid,
    String username,
    String applicationName,
    String clientAddress,
    String state,
    String waitEventType,
    Instant queryStart,
    Double durationSeconds,
    String query
) {
}
