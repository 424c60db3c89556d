package com.platform.dbwatch.connectors;

import com.platform.dbwatch.error.ErrorCode;
import com.platform.dbwatch.error.ResourceNotFoundException;
import com.platform.dbwatch.persistence.entity.DatabaseConnectionEntity;
import com.platform.dbwatch.persistence.entity.InstanceEntity;
import com.platform.dbwatch.persistence.repository.DatabaseConnectionJpaRepository;
import com.platform.dbwatch.persistence.repository.InstanceJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds target descriptors from the records kept by the administrative layer.
 */
@Component
@RequiredArgsConstructor
public class TargetResolver {
    
    private final DatabaseConnectionJpaRepository databaseRepository;
    private final InstanceJpaRepository instanceRepository;
    
    public TargetDescriptor forDatabase(long databaseId) {
        DatabaseConnectionEntity database = databaseRepository.findById(databaseId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.DATABASE_NOT_FOUND, "Database", databaseId));
        InstanceEntity instance = instanceRepository.findById(database.getInstanceId())
            .orElseThrow(() -> new ResourceNotFoundException("Instance", database.getInstanceId()));
        return TargetDescriptor.forDatabase(database, instance);
    }
    
    public boolean databaseExists(long databaseId) {
        return databaseRepository.existsById(databaseId);
    }
}
