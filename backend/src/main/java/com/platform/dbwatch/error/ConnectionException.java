package com.platform.dbwatch.error;

/**
 * A target (instance or database) could not be reached.
 * Wraps tunnel, authentication and network failures so callers never see driver errors.
 */
public class ConnectionException extends DbWatchException {
    
    private final String target;
    
    public ConnectionException(ErrorCode errorCode, String target, String reason, Throwable cause) {
        super(errorCode, String.format("Failed to connect to %s: %s", target, reason), cause);
        this.target = target;
    }
    
    public static ConnectionException tunnelFailed(String target, Throwable cause) {
        return new ConnectionException(ErrorCode.TUNNEL_FAILED, target,
            "SSH tunnel failed (" + cause.getMessage() + ")", cause);
    }
    
    public static ConnectionException connectFailed(ErrorCode errorCode, String target, Throwable cause) {
        return new ConnectionException(errorCode, target, cause.getMessage(), cause);
    }
    
    public String getTarget() {
        return target;
    }
}
