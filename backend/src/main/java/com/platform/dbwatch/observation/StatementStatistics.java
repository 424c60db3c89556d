package com.platform.dbwatch.observation;

/**
 * Cumulative counters read for one statement text. Times are in milliseconds;
 * min/max/mean may be absent on servers that do not report them.
 */
public record StatementStatistics(
    long calls,
    double totalTime,
    Double minTime,
    Double maxTime,
    Double meanTime
) {
}
