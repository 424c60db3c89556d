package com.platform.dbwatch.error;

/**
 * The statistics extension is not installed or not preloaded on the target.
 */
public class ExtensionUnavailableException extends DbWatchException {
    
    private final String target;
    private final String extension;
    
    public ExtensionUnavailableException(String target, String extension) {
        super(ErrorCode.EXTENSION_UNAVAILABLE,
            String.format("Extension %s is not available on %s", extension, target));
        this.target = target;
        this.extension = extension;
    }
    
    public ExtensionUnavailableException(String target, String extension, Throwable cause) {
        super(ErrorCode.EXTENSION_UNAVAILABLE,
            String.format("Extension %s is not usable on %s: %s", extension, target, cause.getMessage()),
            cause);
        this.target = target;
        this.extension = extension;
    }
    
    public String getTarget() {
        return target;
    }
    
    public String getExtension() {
        return extension;
    }
}
