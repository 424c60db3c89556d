package com.platform.dbwatch.healthcheck;

import java.time.Instant;

/**
 * Returned as soon as a run is accepted; the run itself continues in the background.
 */
public record ExecutionHandle(long executionId, long clusterId, ExecutionStatus status, Instant startedAt) {
}
