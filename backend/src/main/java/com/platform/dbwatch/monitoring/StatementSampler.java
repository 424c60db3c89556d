package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.connectors.ConnectionProvider;
import com.platform.dbwatch.connectors.TargetDescriptor;
import com.platform.dbwatch.connectors.TargetResolver;
import com.platform.dbwatch.observation.ObservationStore;
import com.platform.dbwatch.observation.UpsertResult;
import com.platform.dbwatch.statement.NormalizedStatement;
import com.platform.dbwatch.statement.StatementNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Takes one snapshot of a database's statement statistics and folds it into the observation store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementSampler {
    
    private final TargetResolver targetResolver;
    private final ConnectionProvider connectionProvider;
    private final StatementStatisticsReader statisticsReader;
    private final StatementNormalizer normalizer;
    private final ObservationStore observationStore;
    private final Clock clock;
    
    public CycleOutcome sample(long databaseId) {
        TargetDescriptor target = targetResolver.forDatabase(databaseId);
        
        List<StatementStatisticsRow> rows;
        try (ConnectionLease lease = connectionProvider.resolve(target)) {
            rows = statisticsReader.read(lease);
        }
        Instant observedAt = clock.instant();
        
        int newStatements = 0;
        int updatedStatements = 0;
        int newSamples = 0;
        int updatedSamples = 0;
        for (StatementStatisticsRow row : rows) {
            NormalizedStatement normalized = normalizer.normalizeAndHash(row.queryText());
            UpsertResult statement = observationStore.upsertCanonicalStatement(
                databaseId, normalized.canonicalText(), normalized.signature(), observedAt);
            if (statement.created()) {
                newStatements++;
            } else {
                updatedStatements++;
            }
            
            UpsertResult sample = observationStore.upsertSample(statement.id(), databaseId, row.queryText(),
                normalizer.hash(row.queryText()), row.statistics(), observedAt);
            if (sample.created()) {
                newSamples++;
            } else {
                updatedSamples++;
            }
        }
        
        CycleOutcome outcome = new CycleOutcome(rows.size(), newStatements, updatedStatements, newSamples, updatedSamples);
        log.debug("Sampled {}: {}", target.label(), outcome);
        return outcome;
    }
}
