package com.platform.dbwatch.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends DbWatchException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, Object resourceId) {
        this(ErrorCode.RESOURCE_NOT_FOUND, resourceType, resourceId);
    }
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, Object resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
