package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.persistence.entity.HealthCheckDefinitionEntity;
import com.platform.dbwatch.persistence.repository.HealthCheckDefinitionJpaRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultHealthChecksConfig")
class DefaultHealthChecksConfigTest {
    
    @Mock
    private HealthCheckDefinitionJpaRepository definitionRepository;
    
    @Test
    @DisplayName("built-in checks have unique titles and increasing display order")
    void defaultsAreWellFormed() {
        List<HealthCheckDefinitionEntity> defaults = DefaultHealthChecksConfig.defaultChecks();
        
        assertThat(defaults).extracting(HealthCheckDefinitionEntity::getTitle).doesNotHaveDuplicates();
        assertThat(defaults).extracting(HealthCheckDefinitionEntity::getDisplayOrder).isSorted();
        assertThat(defaults).allSatisfy(d -> {
            assertThat(d.getQueryText()).isNotBlank();
            assertThat(d.isActive()).isTrue();
        });
    }
    
    @Test
    @DisplayName("only missing titles are inserted")
    void seedsMissingOnly() {
        List<HealthCheckDefinitionEntity> defaults = DefaultHealthChecksConfig.defaultChecks();
        String existing = defaults.get(0).getTitle();
        when(definitionRepository.findByTitle(anyString())).thenAnswer(inv ->
            existing.equals(inv.getArgument(0)) ? Optional.of(defaults.get(0)) : Optional.empty());
        
        new DefaultHealthChecksConfig(definitionRepository, true).initializeDefaultChecks();
        
        ArgumentCaptor<HealthCheckDefinitionEntity> saved = ArgumentCaptor.forClass(HealthCheckDefinitionEntity.class);
        verify(definitionRepository, times(defaults.size() - 1)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(HealthCheckDefinitionEntity::getTitle).doesNotContain(existing);
    }
    
    @Test
    @DisplayName("seeding can be switched off")
    void seedingDisabled() {
        new DefaultHealthChecksConfig(definitionRepository, false).initializeDefaultChecks();
        
        verifyNoInteractions(definitionRepository);
    }
}
