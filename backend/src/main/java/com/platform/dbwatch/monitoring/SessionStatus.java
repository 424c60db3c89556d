package com.platform.dbwatch.monitoring;

import java.time.Instant;

public record SessionStatus(
    long sessionId,
    long databaseId,
    String requestedBy,
    boolean active,
    SessionState state,
    int intervalSeconds,
    Instant lastRunAt,
    Instant scheduledEndTime,
    Instant startedAt,
    Instant stoppedAt,
    String lastCycleError
) {
}
