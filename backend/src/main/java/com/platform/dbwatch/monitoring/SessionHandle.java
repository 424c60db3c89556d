package com.platform.dbwatch.monitoring;

import java.time.Instant;

/**
 * Returned by a successful start. Identifies the monitoring record driving the loop.
 */
public record SessionHandle(
    long sessionId,
    long databaseId,
    SessionState state,
    int intervalSeconds,
    Instant scheduledEndTime,
    Instant startedAt
) {
}
