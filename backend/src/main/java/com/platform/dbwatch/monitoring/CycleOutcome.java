package com.platform.dbwatch.monitoring;

/**
 * Tally of one sampling cycle.
 */
public record CycleOutcome(
    int statementsSeen,
    int newStatements,
    int updatedStatements,
    int newSamples,
    int updatedSamples
) {
    
    public static CycleOutcome empty() {
        return new CycleOutcome(0, 0, 0, 0, 0);
    }
}
