package com.platform.dbwatch.observation;

import java.time.Instant;

public record StatementSampleView(
    long id,
    long canonicalStatementId,
    String rawText,
    String rawHash,
    long calls,
    double totalTime,
    Double minTime,
    Double maxTime,
    Double meanTime,
    Instant collectedAt,
    Instant lastUpdatedAt
) {
}
