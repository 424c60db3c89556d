package com.platform.dbwatch.observation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.error.ValidationException;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.StatementGroupEntity;
import com.platform.dbwatch.persistence.repository.CanonicalStatementJpaRepository;
import com.platform.dbwatch.persistence.repository.DatabaseConnectionJpaRepository;
import com.platform.dbwatch.persistence.repository.StatementGroupJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatementGroupService")
class StatementGroupServiceTest {
    
    @Mock
    private StatementGroupJpaRepository groupRepository;
    
    @Mock
    private CanonicalStatementJpaRepository statementRepository;
    
    @Mock
    private DatabaseConnectionJpaRepository databaseRepository;
    
    private StatementGroupService service;
    
    @BeforeEach
    void setUp() {
        service = new StatementGroupService(groupRepository, statementRepository, databaseRepository,
            new EntityMappers(new ObjectMapper()));
    }
    
    @Test
    @DisplayName("creates a group on an existing database")
    void createsGroup() {
        when(databaseRepository.existsById(7L)).thenReturn(true);
        when(groupRepository.save(any(StatementGroupEntity.class))).thenAnswer(inv -> {
            StatementGroupEntity entity = inv.getArgument(0);
            entity.setId(3L);
            return entity;
        });
        
        StatementGroupView view = service.createGroup(7L, "  reporting  ", "nightly jobs", "alice");
        
        assertThat(view.id()).isEqualTo(3L);
        assertThat(view.name()).isEqualTo("reporting");
        assertThat(view.databaseId()).isEqualTo(7L);
        assertThat(view.createdBy()).isEqualTo("alice");
    }
    
    @Test
    @DisplayName("rejects a blank name and an unknown database")
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> service.createGroup(7L, " ", null, "alice"))
            .isInstanceOf(ValidationException.class);
        
        when(databaseRepository.existsById(8L)).thenReturn(false);
        assertThatThrownBy(() -> service.createGroup(8L, "reporting", null, "alice"))
            .isInstanceOf(ResourceNotFoundException.class);
        verify(groupRepository, never()).save(any());
    }
    
    @Test
    @DisplayName("lists the groups of one database in name order")
    void listsGroupsOfDatabase() {
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        when(databaseRepository.existsById(7L)).thenReturn(true);
        when(groupRepository.findByDatabaseIdOrderByNameAsc(7L)).thenReturn(List.of(
            StatementGroupEntity.builder().id(4L).databaseId(7L).name("batch").createdBy("bob").createdAt(created).build(),
            StatementGroupEntity.builder().id(3L).databaseId(7L).name("reporting").description("nightly jobs")
                .createdBy("alice").createdAt(created).build()));
        
        List<StatementGroupView> groups = service.listGroups(7L);
        
        assertThat(groups).extracting(StatementGroupView::name).containsExactly("batch", "reporting");
        assertThat(groups).extracting(StatementGroupView::databaseId).containsOnly(7L);
        assertThat(groups.get(1).description()).isEqualTo("nightly jobs");
        verify(groupRepository).findByDatabaseIdOrderByNameAsc(7L);
        verify(groupRepository, never()).findByDatabaseIdOrderByNameAsc(8L);
    }
    
    @Test
    @DisplayName("a database without groups lists nothing")
    void listsNoGroups() {
        when(databaseRepository.existsById(8L)).thenReturn(true);
        when(groupRepository.findByDatabaseIdOrderByNameAsc(8L)).thenReturn(List.of());
        
        assertThat(service.listGroups(8L)).isEmpty();
    }
    
    @Test
    @DisplayName("listing the groups of an unknown database is not found")
    void listGroupsOfUnknownDatabase() {
        when(databaseRepository.existsById(99L)).thenReturn(false);
        
        assertThatThrownBy(() -> service.listGroups(99L)).isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(groupRepository);
    }
    
    @Test
    @DisplayName("deleting a group ungroups its statements before removing it")
    void deleteUngroupsStatements() {
        StatementGroupEntity group = StatementGroupEntity.builder().id(3L).databaseId(7L).name("reporting").build();
        when(groupRepository.findById(3L)).thenReturn(Optional.of(group));
        when(statementRepository.clearGroup(3L)).thenReturn(4);
        
        service.deleteGroup(3L);
        
        InOrder order = inOrder(statementRepository, groupRepository);
        order.verify(statementRepository).clearGroup(3L);
        order.verify(groupRepository).delete(group);
    }
    
    @Test
    @DisplayName("deleting an unknown group is not found")
    void deleteUnknownGroup() {
        when(groupRepository.findById(9L)).thenReturn(Optional.empty());
        
        assertThatThrownBy(() -> service.deleteGroup(9L)).isInstanceOf(ResourceNotFoundException.class);
        verify(statementRepository, never()).clearGroup(any());
    }
}
