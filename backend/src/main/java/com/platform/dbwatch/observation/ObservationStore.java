package com.platform.dbwatch.observation;

import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.error.ValidationException;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.CanonicalStatementEntity;
import com.platform.dbwatch.persistence.entity.StatementGroupEntity;
import com.platform.dbwatch.persistence.entity.StatementSampleEntity;
import com.platform.dbwatch.persistence.repository.CanonicalStatementJpaRepository;
import com.platform.dbwatch.persistence.repository.StatementGroupJpaRepository;
import com.platform.dbwatch.persistence.repository.StatementSampleJpaRepository;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persistent record of every canonical statement observed on a database and the
 * concrete texts (samples) that produced it.
 * 
 * Upserts run without an outer transaction: each insert commits on its own, so a
 * lost race on the natural key rolls back only that insert and the winner's row is
 * re-read and updated.
 */
@Slf4j
@Service
public class ObservationStore {
    
    private final CanonicalStatementJpaRepository statementRepository;
    private final StatementSampleJpaRepository sampleRepository;
    private final StatementGroupJpaRepository groupRepository;
    private final EntityMappers entityMappers;
    private final int defaultLimit;
    private final int maxLimit;
    
    public ObservationStore(
            CanonicalStatementJpaRepository statementRepository,
            StatementSampleJpaRepository sampleRepository,
            StatementGroupJpaRepository groupRepository,
            EntityMappers entityMappers,
            @Value("${dbwatch.query.default-limit:100}") int defaultLimit,
            @Value("${dbwatch.query.max-limit:1000}") int maxLimit) {
        this.statementRepository = statementRepository;
        this.sampleRepository = sampleRepository;
        this.groupRepository = groupRepository;
        this.entityMappers = entityMappers;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }
    
    /**
     * Insert the canonical statement, or advance its last seen time.
     */
    public UpsertResult upsertCanonicalStatement(long databaseId, String canonicalText, String signature,
                                                 Instant observedAt) {
        var existing = statementRepository.findByDatabaseIdAndCanonicalHash(databaseId, signature);
        if (existing.isPresent()) {
            return UpsertResult.updated(touch(existing.get(), observedAt));
        }
        
        CanonicalStatementEntity entity = CanonicalStatementEntity.builder()
            .databaseId(databaseId)
            .canonicalText(canonicalText)
            .canonicalHash(signature)
            .firstSeenAt(observedAt)
            .lastSeenAt(observedAt)
            .known(false)
            .build();
        try {
            return UpsertResult.inserted(statementRepository.saveAndFlush(entity).getId());
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert of statement {} on database {}, updating instead", signature, databaseId);
            CanonicalStatementEntity winner = statementRepository
                .findByDatabaseIdAndCanonicalHash(databaseId, signature)
                .orElseThrow(() -> e);
            return UpsertResult.updated(touch(winner, observedAt));
        }
    }
    
    /**
     * Insert the sample, or overwrite its statistics with the latest reading.
     */
    public UpsertResult upsertSample(long canonicalId, long databaseId, String rawText, String rawHash,
                                     StatementStatistics statistics, Instant observedAt) {
        var existing = sampleRepository.findByCanonicalStatementIdAndRawHash(canonicalId, rawHash);
        if (existing.isPresent()) {
            return UpsertResult.updated(overwrite(existing.get(), statistics, observedAt));
        }
        
        StatementSampleEntity entity = StatementSampleEntity.builder()
            .canonicalStatementId(canonicalId)
            .databaseId(databaseId)
            .rawText(rawText)
            .rawHash(rawHash)
            .calls(statistics.calls())
            .totalTime(statistics.totalTime())
            .minTime(statistics.minTime())
            .maxTime(statistics.maxTime())
            .meanTime(statistics.meanTime())
            .collectedAt(observedAt)
            .lastUpdatedAt(observedAt)
            .build();
        try {
            return UpsertResult.inserted(sampleRepository.saveAndFlush(entity).getId());
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert of sample {} for statement {}, updating instead", rawHash, canonicalId);
            StatementSampleEntity winner = sampleRepository
                .findByCanonicalStatementIdAndRawHash(canonicalId, rawHash)
                .orElseThrow(() -> e);
            return UpsertResult.updated(overwrite(winner, statistics, observedAt));
        }
    }
    
    /**
     * Apply a manual classification. Only the fields present in the update change.
     */
    @Transactional
    public CanonicalStatementView setTriage(long canonicalId, TriageUpdate update) {
        CanonicalStatementEntity statement = statementRepository.findById(canonicalId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.STATEMENT_NOT_FOUND, "Statement", canonicalId));
        
        if (update.known() != null) {
            statement.setKnown(update.known());
        }
        if (update.clearGroup()) {
            statement.setGroupId(null);
        } else if (update.groupId() != null) {
            StatementGroupEntity group = groupRepository.findById(update.groupId())
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.GROUP_NOT_FOUND, "Group", update.groupId()));
            if (!group.getDatabaseId().equals(statement.getDatabaseId())) {
                throw new ValidationException("groupId", update.groupId(),
                    "group belongs to database " + group.getDatabaseId());
            }
            statement.setGroupId(group.getId());
        }
        
        CanonicalStatementEntity saved = statementRepository.save(statement);
        log.info("Statement {} triaged: known={}, groupId={}", canonicalId, saved.isKnown(), saved.getGroupId());
        return aggregate(saved, sampleRepository.findByCanonicalStatementIdOrderByLastUpdatedAtDesc(canonicalId));
    }
    
    /**
     * Canonical statements of a database, most recently seen first, with per-statement aggregates.
     */
    @Transactional(readOnly = true)
    public List<CanonicalStatementView> query(long databaseId, StatementQueryFilter filter) {
        StatementQueryFilter effective = filter != null ? filter : StatementQueryFilter.unfiltered();
        if (effective.getFrom() != null && effective.getTo() != null && effective.getFrom().isAfter(effective.getTo())) {
            throw new ValidationException("from", effective.getFrom(), "must not be after 'to'");
        }
        int limit = resolveLimit(effective.getLimit());
        
        List<CanonicalStatementEntity> statements = statementRepository.findAll(
            specificationFor(databaseId, effective),
            PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "lastSeenAt").and(Sort.by("id")))
        ).getContent();
        if (statements.isEmpty()) {
            return List.of();
        }
        
        Map<Long, List<StatementSampleEntity>> samplesByStatement = sampleRepository
            .findByCanonicalStatementIdIn(statements.stream().map(CanonicalStatementEntity::getId).toList())
            .stream()
            .collect(Collectors.groupingBy(StatementSampleEntity::getCanonicalStatementId));
        
        List<CanonicalStatementView> views = new ArrayList<>(statements.size());
        for (CanonicalStatementEntity statement : statements) {
            views.add(aggregate(statement, samplesByStatement.getOrDefault(statement.getId(), List.of())));
        }
        return views;
    }
    
    /**
     * Concrete texts recorded for one canonical statement, most recently updated first.
     */
    @Transactional(readOnly = true)
    public List<StatementSampleView> listSamples(long canonicalId) {
        if (!statementRepository.existsById(canonicalId)) {
            throw new ResourceNotFoundException(ErrorCode.STATEMENT_NOT_FOUND, "Statement", canonicalId);
        }
        return sampleRepository.findByCanonicalStatementIdOrderByLastUpdatedAtDesc(canonicalId).stream()
            .map(entityMappers::toView)
            .toList();
    }
    
    private long touch(CanonicalStatementEntity statement, Instant observedAt) {
        if (observedAt.isAfter(statement.getLastSeenAt())) {
            statement.setLastSeenAt(observedAt);
            statementRepository.save(statement);
        }
        return statement.getId();
    }
    
    private long overwrite(StatementSampleEntity sample, StatementStatistics statistics, Instant observedAt) {
        sample.setCalls(statistics.calls());
        sample.setTotalTime(statistics.totalTime());
        sample.setMinTime(statistics.minTime());
        sample.setMaxTime(statistics.maxTime());
        sample.setMeanTime(statistics.meanTime());
        sample.setLastUpdatedAt(observedAt);
        sampleRepository.save(sample);
        return sample.getId();
    }
    
    int resolveLimit(Integer requested) {
        if (requested == null) {
            return Math.min(defaultLimit, maxLimit);
        }
        if (requested < 1) {
            throw new ValidationException("limit", requested, "must be at least 1");
        }
        return Math.min(requested, maxLimit);
    }
    
    static CanonicalStatementView aggregate(CanonicalStatementEntity statement, List<StatementSampleEntity> samples) {
        long totalCalls = 0;
        double totalTime = 0;
        Double minTime = null;
        Double maxTime = null;
        for (StatementSampleEntity sample : samples) {
            totalCalls += sample.getCalls();
            totalTime += sample.getTotalTime();
            if (sample.getMinTime() != null) {
                minTime = minTime == null ? sample.getMinTime() : Math.min(minTime, sample.getMinTime());
            }
            if (sample.getMaxTime() != null) {
                maxTime = maxTime == null ? sample.getMaxTime() : Math.max(maxTime, sample.getMaxTime());
            }
        }
        String representative = samples.stream()
            .max(Comparator.comparing(StatementSampleEntity::getLastUpdatedAt)
                .thenComparing(StatementSampleEntity::getId, Comparator.nullsFirst(Comparator.naturalOrder())))
            .map(StatementSampleEntity::getRawText)
            .orElse(statement.getCanonicalText());
        
        return new CanonicalStatementView(
            statement.getId(),
            statement.getDatabaseId(),
            statement.getCanonicalText(),
            statement.getCanonicalHash(),
            statement.getFirstSeenAt(),
            statement.getLastSeenAt(),
            statement.isKnown(),
            statement.getGroupId(),
            samples.size(),
            totalCalls,
            totalTime,
            minTime,
            maxTime,
            totalCalls > 0 ? totalTime / totalCalls : 0.0,
            representative
        );
    }
    
    static Specification<CanonicalStatementEntity> specificationFor(long databaseId, StatementQueryFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("databaseId"), databaseId));
            
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("lastSeenAt"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("lastSeenAt"), filter.getTo()));
            }
            
            if (filter.getKnown() != null) {
                predicates.add(cb.equal(root.get("known"), filter.getKnown()));
            } else if (!filter.isIncludeKnown()) {
                predicates.add(cb.isFalse(root.<Boolean>get("known")));
            }
            
            if (filter.isUngroupedOnly()) {
                predicates.add(cb.isNull(root.get("groupId")));
            } else if (filter.getGroupId() != null) {
                predicates.add(cb.equal(root.get("groupId"), filter.getGroupId()));
            }
            
            if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
                Subquery<Long> matching = query.subquery(Long.class);
                Root<StatementSampleEntity> sample = matching.from(StatementSampleEntity.class);
                matching.select(sample.<Long>get("canonicalStatementId")).where(
                    cb.equal(sample.get("canonicalStatementId"), root.get("id")),
                    cb.like(cb.lower(sample.<String>get("rawText")), likePattern(filter.getSearch()), '\\')
                );
                predicates.add(cb.exists(matching));
            }
            
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
    
    /**
     * Lower-cased contains-pattern with LIKE wildcards in the search term escaped.
     */
    static String likePattern(String search) {
        String escaped = search.trim().toLowerCase(Locale.ROOT)
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
