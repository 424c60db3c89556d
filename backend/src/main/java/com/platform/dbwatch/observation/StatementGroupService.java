package com.platform.dbwatch.observation;

import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.error.ValidationException;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.entity.StatementGroupEntity;
import com.platform.dbwatch.persistence.repository.CanonicalStatementJpaRepository;
import com.platform.dbwatch.persistence.repository.DatabaseConnectionJpaRepository;
import com.platform.dbwatch.persistence.repository.StatementGroupJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * User-defined buckets for triaging canonical statements of one database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatementGroupService {
    
    private final StatementGroupJpaRepository groupRepository;
    private final CanonicalStatementJpaRepository statementRepository;
    private final DatabaseConnectionJpaRepository databaseRepository;
    private final EntityMappers entityMappers;
    
    @Transactional
    public StatementGroupView createGroup(long databaseId, String name, String description, String createdBy) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", name, "must not be blank");
        }
        if (!databaseRepository.existsById(databaseId)) {
            throw new ResourceNotFoundException(ErrorCode.DATABASE_NOT_FOUND, "Database", databaseId);
        }
        
        StatementGroupEntity saved = groupRepository.save(StatementGroupEntity.builder()
            .databaseId(databaseId)
            .name(name.trim())
            .description(description)
            .createdBy(createdBy)
            .build());
        log.info("Created statement group {} '{}' on database {}", saved.getId(), saved.getName(), databaseId);
        return entityMappers.toView(saved);
    }
    
    /**
     * Groups of one database ordered by name.
     */
    @Transactional(readOnly = true)
    public List<StatementGroupView> listGroups(long databaseId) {
        if (!databaseRepository.existsById(databaseId)) {
            throw new ResourceNotFoundException(ErrorCode.DATABASE_NOT_FOUND, "Database", databaseId);
        }
        return groupRepository.findByDatabaseIdOrderByNameAsc(databaseId).stream()
            .map(entityMappers::toView)
            .toList();
    }
    
    /**
     * Delete a group. Its statements stay and become ungrouped.
     */
    @Transactional
    public void deleteGroup(long groupId) {
        StatementGroupEntity group = groupRepository.findById(groupId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.GROUP_NOT_FOUND, "Group", groupId));
        
        int detached = statementRepository.clearGroup(groupId);
        groupRepository.delete(group);
        log.info("Deleted statement group {} on database {}, {} statements ungrouped",
            groupId, group.getDatabaseId(), detached);
    }
}
