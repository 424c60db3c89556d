package com.platform.dbwatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools for sampling loops and health check runs, and the clock every component reads.
 */
@Slf4j
@Configuration
public class SchedulingConfig {
    
    /**
     * Shared by all sampling loops. Each loop has at most one cycle pending or running.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(
            @Value("${dbwatch.monitoring.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("sampling-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        log.info("Sampling scheduler configured with {} threads", poolSize);
        return scheduler;
    }
    
    @Bean(name = "healthCheckExecutor")
    public ThreadPoolTaskExecutor healthCheckExecutor(
            @Value("${dbwatch.healthcheck.executor.core-pool-size:2}") int corePoolSize,
            @Value("${dbwatch.healthcheck.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${dbwatch.healthcheck.executor.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("healthcheck-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
