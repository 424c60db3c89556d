package com.platform.dbwatch.error;

/**
 * Standardized error codes for the observability core.
 * 
 * Format: DW-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Target system errors (connections, extensions, queries)
 * - 5xx: Health check catalog errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DW-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DW-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DW-300", "Resource not found", ErrorCategory.RECOVERABLE),
    DATABASE_NOT_FOUND("DW-301", "Database not found", ErrorCategory.RECOVERABLE),
    SESSION_NOT_FOUND("DW-302", "Monitoring session not found", ErrorCategory.RECOVERABLE),
    CLUSTER_NOT_FOUND("DW-303", "Cluster not found", ErrorCategory.RECOVERABLE),
    EXECUTION_NOT_FOUND("DW-304", "Health check execution not found", ErrorCategory.RECOVERABLE),
    STATEMENT_NOT_FOUND("DW-305", "Canonical statement not found", ErrorCategory.RECOVERABLE),
    GROUP_NOT_FOUND("DW-306", "Statement group not found", ErrorCategory.RECOVERABLE),
    MONITORING_ALREADY_ACTIVE("DW-310", "Monitoring already active for database", ErrorCategory.RECOVERABLE),
    
    // ==================== Target System Errors (4xx) ====================
    
    CONNECTION_FAILED("DW-400", "Connection to target failed", ErrorCategory.RECOVERABLE),
    TUNNEL_FAILED("DW-401", "SSH tunnel could not be established", ErrorCategory.RECOVERABLE),
    AUTHENTICATION_FAILED("DW-402", "Target rejected credentials", ErrorCategory.RECOVERABLE),
    CONNECTION_TIMEOUT("DW-403", "Connection to target timed out", ErrorCategory.RECOVERABLE),
    EXTENSION_UNAVAILABLE("DW-410", "Statistics extension unavailable", ErrorCategory.RECOVERABLE),
    TARGET_QUERY_FAILED("DW-420", "Query on target failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Catalog Errors (5xx) ====================
    
    NO_WRITER_INSTANCE("DW-500", "Cluster has no writer instance", ErrorCategory.FATAL),
    EMPTY_CATALOG("DW-501", "No active health check definitions", ErrorCategory.FATAL),
    NO_INSTANCES("DW-502", "Cluster has no instances", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * The failing operation can be retried or the request corrected.
         */
        RECOVERABLE,
        
        /**
         * The operation cannot proceed until the configuration changes.
         */
        FATAL
    }
}
