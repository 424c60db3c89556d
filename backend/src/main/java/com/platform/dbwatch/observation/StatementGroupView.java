package com.platform.dbwatch.observation;

import java.time.Instant;

public record StatementGroupView(
    long id,
    long databaseId,
    String name,
    String description,
    String createdBy,
    Instant createdAt
) {
}
