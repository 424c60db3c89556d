package com.platform.dbwatch.error;

/**
 * A diagnostic query failed on one target.
 */
public class TargetExecutionException extends DbWatchException {
    
    private final String target;
    private final String check;
    
    public TargetExecutionException(String check, String target, Throwable cause) {
        super(ErrorCode.TARGET_QUERY_FAILED,
            String.format("Check '%s' failed on %s: %s", check, target, cause.getMessage()), cause);
        this.target = target;
        this.check = check;
    }
    
    public String getTarget() {
        return target;
    }
    
    public String getCheck() {
        return check;
    }
}
