package com.platform.dbwatch.observation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.error.ValidationException;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.CanonicalStatementEntity;
import com.platform.dbwatch.persistence.entity.StatementGroupEntity;
import com.platform.dbwatch.persistence.entity.StatementSampleEntity;
import com.platform.dbwatch.persistence.repository.CanonicalStatementJpaRepository;
import com.platform.dbwatch.persistence.repository.StatementGroupJpaRepository;
import com.platform.dbwatch.persistence.repository.StatementSampleJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ObservationStore")
class ObservationStoreTest {
    
    private static final long DATABASE_ID = 7L;
    private static final String SIGNATURE = "0123456789abcdef0123456789abcdef";
    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T10:05:00Z");
    
    @Mock
    private CanonicalStatementJpaRepository statementRepository;
    
    @Mock
    private StatementSampleJpaRepository sampleRepository;
    
    @Mock
    private StatementGroupJpaRepository groupRepository;
    
    private ObservationStore store;
    
    @BeforeEach
    void setUp() {
        store = new ObservationStore(statementRepository, sampleRepository, groupRepository,
            new EntityMappers(new ObjectMapper()), 100, 1000);
    }
    
    @Test
    @DisplayName("first observation inserts an unknown statement with first and last seen equal")
    void insertsNewCanonicalStatement() {
        when(statementRepository.findByDatabaseIdAndCanonicalHash(DATABASE_ID, SIGNATURE)).thenReturn(Optional.empty());
        when(statementRepository.saveAndFlush(any(CanonicalStatementEntity.class))).thenAnswer(inv -> {
            CanonicalStatementEntity entity = inv.getArgument(0);
            entity.setId(11L);
            return entity;
        });
        
        UpsertResult result = store.upsertCanonicalStatement(DATABASE_ID, "SELECT ?", SIGNATURE, T1);
        
        assertThat(result).isEqualTo(UpsertResult.inserted(11L));
        ArgumentCaptor<CanonicalStatementEntity> saved = ArgumentCaptor.forClass(CanonicalStatementEntity.class);
        verify(statementRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getFirstSeenAt()).isEqualTo(T1);
        assertThat(saved.getValue().getLastSeenAt()).isEqualTo(T1);
        assertThat(saved.getValue().isKnown()).isFalse();
    }
    
    @Test
    @DisplayName("a later observation advances last seen and keeps first seen")
    void laterObservationAdvancesLastSeen() {
        CanonicalStatementEntity existing = statement(11L, T1, T1);
        when(statementRepository.findByDatabaseIdAndCanonicalHash(DATABASE_ID, SIGNATURE)).thenReturn(Optional.of(existing));
        
        UpsertResult result = store.upsertCanonicalStatement(DATABASE_ID, "SELECT ?", SIGNATURE, T2);
        
        assertThat(result).isEqualTo(UpsertResult.updated(11L));
        assertThat(existing.getFirstSeenAt()).isEqualTo(T1);
        assertThat(existing.getLastSeenAt()).isEqualTo(T2);
        verify(statementRepository).save(existing);
    }
    
    @Test
    @DisplayName("an out-of-order observation never moves last seen backwards")
    void olderObservationKeepsLastSeen() {
        CanonicalStatementEntity existing = statement(11L, T1, T2);
        when(statementRepository.findByDatabaseIdAndCanonicalHash(DATABASE_ID, SIGNATURE)).thenReturn(Optional.of(existing));
        
        store.upsertCanonicalStatement(DATABASE_ID, "SELECT ?", SIGNATURE, T1);
        
        assertThat(existing.getLastSeenAt()).isEqualTo(T2);
        assertThat(existing.getFirstSeenAt()).isEqualTo(T1);
        verify(statementRepository, never()).save(any());
    }
    
    @Test
    @DisplayName("losing an insert race re-reads the winner and updates it")
    void insertRaceConverges() {
        CanonicalStatementEntity winner = statement(12L, T1, T1);
        when(statementRepository.findByDatabaseIdAndCanonicalHash(DATABASE_ID, SIGNATURE))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(winner));
        when(statementRepository.saveAndFlush(any(CanonicalStatementEntity.class)))
            .thenThrow(new DataIntegrityViolationException("uq_canonical_db_hash"));
        
        UpsertResult result = store.upsertCanonicalStatement(DATABASE_ID, "SELECT ?", SIGNATURE, T2);
        
        assertThat(result).isEqualTo(UpsertResult.updated(12L));
        assertThat(winner.getLastSeenAt()).isEqualTo(T2);
    }
    
    @Test
    @DisplayName("an existing sample is overwritten with the latest statistics")
    void overwritesExistingSample() {
        StatementSampleEntity existing = sample(21L, 11L, "SELECT 1", 5, 10.0, 1.0, 3.0, T1);
        when(sampleRepository.findByCanonicalStatementIdAndRawHash(11L, "rawhash")).thenReturn(Optional.of(existing));
        
        UpsertResult result = store.upsertSample(11L, DATABASE_ID, "SELECT 1", "rawhash",
            new StatementStatistics(9, 30.0, 0.5, 9.0, 3.3), T2);
        
        assertThat(result).isEqualTo(UpsertResult.updated(21L));
        assertThat(existing.getCalls()).isEqualTo(9);
        assertThat(existing.getTotalTime()).isEqualTo(30.0);
        assertThat(existing.getMinTime()).isEqualTo(0.5);
        assertThat(existing.getLastUpdatedAt()).isEqualTo(T2);
        assertThat(existing.getCollectedAt()).isEqualTo(T1);
    }
    
    @Test
    @DisplayName("views aggregate over samples and take the most recent sample's text")
    void aggregatesSamples() {
        CanonicalStatementEntity statement = statement(11L, T1, T2);
        StatementSampleEntity older = sample(21L, 11L, "SELECT * FROM t WHERE id = 1", 4, 8.0, 1.0, 4.0, T1);
        StatementSampleEntity newer = sample(22L, 11L, "SELECT * FROM t WHERE id = 2", 6, 12.0, 0.5, 3.0, T2);
        when(statementRepository.findAll(any(Specification.class), any(Pageable.class)))
            .thenReturn(new PageImpl<>(List.of(statement)));
        when(sampleRepository.findByCanonicalStatementIdIn(anyCollection())).thenReturn(List.of(older, newer));
        
        List<CanonicalStatementView> views = store.query(DATABASE_ID, StatementQueryFilter.unfiltered());
        
        assertThat(views).hasSize(1);
        CanonicalStatementView view = views.get(0);
        assertThat(view.sampleCount()).isEqualTo(2);
        assertThat(view.totalCalls()).isEqualTo(10);
        assertThat(view.totalTime()).isEqualTo(20.0);
        assertThat(view.minTime()).isEqualTo(0.5);
        assertThat(view.maxTime()).isEqualTo(4.0);
        assertThat(view.meanTime()).isEqualTo(2.0);
        assertThat(view.representativeText()).isEqualTo("SELECT * FROM t WHERE id = 2");
    }
    
    @Test
    @DisplayName("a statement without calls has a mean of zero")
    void meanIsZeroWithoutCalls() {
        CanonicalStatementView view = ObservationStore.aggregate(statement(11L, T1, T1), List.of());
        
        assertThat(view.totalCalls()).isZero();
        assertThat(view.meanTime()).isZero();
        assertThat(view.minTime()).isNull();
        assertThat(view.representativeText()).isEqualTo("SELECT ?");
    }
    
    @Test
    @DisplayName("an inverted time window is rejected")
    void rejectsInvertedWindow() {
        StatementQueryFilter filter = StatementQueryFilter.builder().from(T2).to(T1).build();
        
        assertThatThrownBy(() -> store.query(DATABASE_ID, filter)).isInstanceOf(ValidationException.class);
    }
    
    @Test
    @DisplayName("limits default to 100 and are capped at the maximum")
    void resolvesLimits() {
        assertThat(store.resolveLimit(null)).isEqualTo(100);
        assertThat(store.resolveLimit(25)).isEqualTo(25);
        assertThat(store.resolveLimit(50_000)).isEqualTo(1000);
        assertThatThrownBy(() -> store.resolveLimit(0)).isInstanceOf(ValidationException.class);
    }
    
    @Test
    @DisplayName("search terms have LIKE wildcards escaped")
    void escapesLikeWildcards() {
        assertThat(ObservationStore.likePattern(" Orders_2024%x ")).isEqualTo("%orders\\_2024\\%x%");
    }
    
    @Test
    @DisplayName("triage only changes the supplied fields")
    void triageChangesSuppliedFields() {
        CanonicalStatementEntity statement = statement(11L, T1, T1);
        statement.setGroupId(5L);
        when(statementRepository.findById(11L)).thenReturn(Optional.of(statement));
        when(statementRepository.save(statement)).thenReturn(statement);
        
        CanonicalStatementView view = store.setTriage(11L, TriageUpdate.markKnown(true));
        
        assertThat(view.known()).isTrue();
        assertThat(view.groupId()).isEqualTo(5L);
    }
    
    @Test
    @DisplayName("assigning a group of another database is rejected")
    void rejectsForeignGroup() {
        when(statementRepository.findById(11L)).thenReturn(Optional.of(statement(11L, T1, T1)));
        when(groupRepository.findById(3L)).thenReturn(Optional.of(
            StatementGroupEntity.builder().id(3L).databaseId(99L).name("other").build()));
        
        assertThatThrownBy(() -> store.setTriage(11L, TriageUpdate.assignGroup(3L)))
            .isInstanceOf(ValidationException.class);
        verify(statementRepository, never()).save(any());
    }
    
    @Test
    @DisplayName("triage of an unknown statement or group is not found")
    void triageOfUnknownIds() {
        when(statementRepository.findById(404L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> store.setTriage(404L, TriageUpdate.markKnown(true)))
            .isInstanceOf(ResourceNotFoundException.class);
        
        when(statementRepository.findById(11L)).thenReturn(Optional.of(statement(11L, T1, T1)));
        when(groupRepository.findById(8L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> store.setTriage(11L, TriageUpdate.assignGroup(8L)))
            .isInstanceOf(ResourceNotFoundException.class);
    }
    
    @Test
    @DisplayName("samples of an unknown statement are not found")
    void listSamplesOfUnknownStatement() {
        when(statementRepository.existsById(99L)).thenReturn(false);
        
        assertThatThrownBy(() -> store.listSamples(99L)).isInstanceOf(ResourceNotFoundException.class);
        verify(sampleRepository, never()).findByCanonicalStatementIdOrderByLastUpdatedAtDesc(any());
    }
    
    @Test
    @DisplayName("samples are listed most recently updated first with their statistics")
    void listSamplesNewestFirst() {
        StatementSampleEntity newer = sample(22L, 11L, "SELECT * FROM t WHERE id = 2", 6, 12.0, 0.5, 3.0, T2);
        StatementSampleEntity older = sample(21L, 11L, "SELECT * FROM t WHERE id = 1", 4, 8.0, 1.0, 4.0, T1);
        when(statementRepository.existsById(11L)).thenReturn(true);
        when(sampleRepository.findByCanonicalStatementIdOrderByLastUpdatedAtDesc(11L)).thenReturn(List.of(newer, older));
        
        List<StatementSampleView> samples = store.listSamples(11L);
        
        assertThat(samples).extracting(StatementSampleView::id).containsExactly(22L, 21L);
        assertThat(samples).allSatisfy(view -> assertThat(view.canonicalStatementId()).isEqualTo(11L));
        StatementSampleView first = samples.get(0);
        assertThat(first.rawText()).isEqualTo("SELECT * FROM t WHERE id = 2");
        assertThat(first.calls()).isEqualTo(6);
        assertThat(first.totalTime()).isEqualTo(12.0);
        assertThat(first.meanTime()).isEqualTo(2.0);
        assertThat(first.lastUpdatedAt()).isEqualTo(T2);
    }
    
    @Test
    @DisplayName("a known statement without samples lists nothing")
    void listSamplesEmpty() {
        when(statementRepository.existsById(11L)).thenReturn(true);
        when(sampleRepository.findByCanonicalStatementIdOrderByLastUpdatedAtDesc(11L)).thenReturn(List.of());
        
        assertThat(store.listSamples(11L)).isEmpty();
    }
    
    private static CanonicalStatementEntity statement(long id, Instant firstSeen, Instant lastSeen) {
        return CanonicalStatementEntity.builder()
            .id(id)
            .databaseId(DATABASE_ID)
            .canonicalText("SELECT ?")
            .canonicalHash(SIGNATURE)
            .firstSeenAt(firstSeen)
            .lastSeenAt(lastSeen)
            .build();
    }
    
    private static StatementSampleEntity sample(long id, long canonicalId, String text, long calls, double total,
                                                double min, double max, Instant updatedAt) {
        return StatementSampleEntity.builder()
            .id(id)
            .canonicalStatementId(canonicalId)
            .databaseId(DATABASE_ID)
            .rawText(text)
            .rawHash("h" + id)
            .calls(calls)
            .totalTime(total)
            .minTime(min)
            .maxTime(max)
            .meanTime(total / calls)
            .collectedAt(T1)
            .lastUpdatedAt(updatedAt)
            .build();
    }
}
