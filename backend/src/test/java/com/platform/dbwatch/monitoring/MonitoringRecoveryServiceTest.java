package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.observability.MetricsRegistry;
import com.platform.dbwatch.persistence.entity.MonitoringSessionEntity;
import com.platform.dbwatch.persistence.repository.MonitoringSessionJpaRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MonitoringRecoveryService")
class MonitoringRecoveryServiceTest {
    
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    
    @Mock
    private MonitoringSessionJpaRepository sessionRepository;
    
    @Mock
    private SamplingCycleExecutor cycleExecutor;
    
    private MonitoringTaskRegistry registry;
    
    @BeforeEach
    void setUp() {
        registry = new MonitoringTaskRegistry(new MetricsRegistry(new SimpleMeterRegistry()));
    }
    
    private MonitoringRecoveryService service(boolean enabled) {
        return new MonitoringRecoveryService(sessionRepository, registry, cycleExecutor,
            new MetricsRegistry(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), enabled);
    }
    
    @Test
    @DisplayName("active sessions resume with an immediate cycle, expired ones are stopped")
    void resumesAndExpires() {
        MonitoringSessionEntity running = session(1L, 10L, null);
        MonitoringSessionEntity expired = session(2L, 20L, NOW.minusSeconds(5));
        MonitoringSessionEntity future = session(3L, 30L, NOW.plusSeconds(3600));
        when(sessionRepository.findByActiveTrue()).thenReturn(List.of(running, expired, future));
        
        service(true).recoverActiveSessions();
        
        verify(sessionRepository).deactivate(2L, SessionState.STOPPED, NOW);
        ArgumentCaptor<SamplingTask> tasks = ArgumentCaptor.forClass(SamplingTask.class);
        verify(cycleExecutor, times(2)).scheduleNow(tasks.capture());
        assertThat(tasks.getAllValues()).extracting(SamplingTask::databaseId).containsExactly(10L, 30L);
        assertThat(registry.find(20L)).isEmpty();
        assertThat(registry.size()).isEqualTo(2);
    }
    
    @Test
    @DisplayName("a failure on one session does not stop the others from resuming")
    void failureIsolated() {
        MonitoringSessionEntity broken = session(1L, 10L, NOW.minusSeconds(5));
        MonitoringSessionEntity healthy = session(2L, 20L, null);
        when(sessionRepository.findByActiveTrue()).thenReturn(List.of(broken, healthy));
        doThrow(new IllegalStateException("store down"))
            .when(sessionRepository).deactivate(1L, SessionState.STOPPED, NOW);
        
        service(true).recoverActiveSessions();
        
        assertThat(registry.find(20L)).isPresent();
    }
    
    @Test
    @DisplayName("recovery can be switched off")
    void disabled() {
        service(false).onApplicationReady();
        
        verifyNoInteractions(sessionRepository, cycleExecutor);
    }
    
    private static MonitoringSessionEntity session(long id, long databaseId, Instant endTime) {
        return MonitoringSessionEntity.builder()
            .id(id)
            .databaseId(databaseId)
            .active(true)
            .state(SessionState.RESTING)
            .intervalSeconds(60)
            .scheduledEndTime(endTime)
            .build();
    }
}
