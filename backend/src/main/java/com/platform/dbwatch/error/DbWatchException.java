package com.platform.dbwatch.error;

/**
 * Base exception for the observability core.
 * Carries an ErrorCode so callers can react without parsing messages.
 */
public abstract class DbWatchException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DbWatchException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DbWatchException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
