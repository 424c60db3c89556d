package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.observation.StatementStatistics;

/**
 * One row of the target's statement statistics view.
 */
public record StatementStatisticsRow(String queryText, StatementStatistics statistics) {
}
