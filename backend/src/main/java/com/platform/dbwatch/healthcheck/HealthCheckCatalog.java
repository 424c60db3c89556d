package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.error.CatalogException;
import com.platform.dbwatch.persistence.EntityMappers;
import com.platform.dbwatch.persistence.repository.HealthCheckDefinitionJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Active health check definitions in display order.
 */
@Component
@RequiredArgsConstructor
public class HealthCheckCatalog {
    
    private final HealthCheckDefinitionJpaRepository definitionRepository;
    private final EntityMappers entityMappers;
    
    /**
     * @throws CatalogException if no definition is active
     */
    @Transactional(readOnly = true)
    public List<HealthCheckDefinition> loadActive() {
        List<HealthCheckDefinition> definitions = definitionRepository.findByActiveTrueOrderByDisplayOrderAscIdAsc()
            .stream()
            .map(entityMappers::toDomain)
            .toList();
        if (definitions.isEmpty()) {
            throw CatalogException.emptyCatalog();
        }
        return definitions;
    }
}
