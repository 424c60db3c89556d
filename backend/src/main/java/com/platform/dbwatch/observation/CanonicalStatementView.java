package com.platform.dbwatch.observation;

import java.time.Instant;

/**
 * A canonical statement with statistics aggregated over all of its samples.
 */
public record CanonicalStatementView(
    long id,
    long databaseId,
    String canonicalText,
    String canonicalHash,
    Instant firstSeenAt,
    Instant lastSeenAt,
    boolean known,
    Long groupId,
    int sampleCount,
    long totalCalls,
    double totalTime,
    Double minTime,
    Double maxTime,
    double meanTime,
    String representativeText
) {
}
