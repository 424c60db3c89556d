package com.platform.dbwatch.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for all application metrics.
 * Provides methods for recording connection, sampling and health check metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger activeSessions;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.activeSessions = new AtomicInteger(0);
        
        Gauge.builder("dbwatch.monitoring.sessions.active", activeSessions, AtomicInteger::get)
            .description("Sampling tasks currently registered")
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record a successful connection to a target.
     */
    public void recordConnectionSuccess(String targetKind, long latencyMs) {
        incrementCounter("dbwatch.connection.success", "kind", targetKind);
        timers.computeIfAbsent("connect." + targetKind, k ->
            Timer.builder("dbwatch.connection.latency")
                .tag("kind", targetKind)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Record a failed connection to a target.
     */
    public void recordConnectionFailure(String targetKind, String errorCode) {
        incrementCounter("dbwatch.connection.failure", "kind", targetKind, "code", errorCode);
    }
    
    /**
     * Record the outcome of one sampling cycle.
     */
    public void recordSamplingCycle(String outcome, int newStatements, int updatedStatements) {
        incrementCounter("dbwatch.monitoring.cycles", "outcome", outcome);
        if (newStatements > 0) {
            counter("dbwatch.monitoring.statements", "kind", "new").increment(newStatements);
        }
        if (updatedStatements > 0) {
            counter("dbwatch.monitoring.statements", "kind", "updated").increment(updatedStatements);
        }
    }
    
    public void sessionRegistered() {
        activeSessions.incrementAndGet();
    }
    
    public void sessionUnregistered() {
        activeSessions.updateAndGet(v -> Math.max(0, v - 1));
    }
    
    /**
     * Record the outcome of resuming sessions at startup.
     */
    public void recordSessionRecovery(int resumed, int expired, int failed) {
        counter("dbwatch.recovery.sessions", "outcome", "resumed").increment(resumed);
        counter("dbwatch.recovery.sessions", "outcome", "expired").increment(expired);
        counter("dbwatch.recovery.sessions", "outcome", "failed").increment(failed);
    }
    
    /**
     * Record one health check result by status.
     */
    public void recordHealthCheckResult(String status) {
        incrementCounter("dbwatch.healthcheck.results", "status", status);
    }
    
    /**
     * Record the final status and duration of a health check run.
     */
    public void recordHealthCheckExecution(String status, long durationMs) {
        incrementCounter("dbwatch.healthcheck.executions", "status", status);
        timers.computeIfAbsent("healthcheck.duration", k ->
            Timer.builder("dbwatch.healthcheck.duration")
                .register(meterRegistry))
            .record(Duration.ofMillis(durationMs));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        counter(name, tags).increment();
    }
    
    private Counter counter(String name, String... tags) {
        String key = name + "." + String.join(".", tags);
        return counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
    }
}
