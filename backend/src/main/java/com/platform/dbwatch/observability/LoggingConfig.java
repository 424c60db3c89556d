package com.platform.dbwatch.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Logging configuration and the MDC keys used to correlate background work.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_DATABASE_ID = "databaseId";
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_EXECUTION_ID = "executionId";
    public static final String MDC_CLUSTER_ID = "clusterId";
    
    @Value("${spring.application.name:dbwatch}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Set sampling loop identity in MDC for logging.
     */
    public static void setSessionContext(long databaseId, long sessionId) {
        MDC.put(MDC_DATABASE_ID, String.valueOf(databaseId));
        MDC.put(MDC_SESSION_ID, String.valueOf(sessionId));
    }
    
    public static void clearSessionContext() {
        MDC.remove(MDC_DATABASE_ID);
        MDC.remove(MDC_SESSION_ID);
    }
    
    /**
     * Set health check run identity in MDC for logging.
     */
    public static void setExecutionContext(long executionId, long clusterId) {
        MDC.put(MDC_EXECUTION_ID, String.valueOf(executionId));
        MDC.put(MDC_CLUSTER_ID, String.valueOf(clusterId));
    }
    
    public static void clearExecutionContext() {
        MDC.remove(MDC_EXECUTION_ID);
        MDC.remove(MDC_CLUSTER_ID);
    }
}
