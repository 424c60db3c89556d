package com.platform.dbwatch.error;

/**
 * A health check run cannot start: the cluster or the catalog does not satisfy its preconditions.
 */
public class CatalogException extends DbWatchException {
    
    public CatalogException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public static CatalogException noWriter(String clusterName) {
        return new CatalogException(ErrorCode.NO_WRITER_INSTANCE,
            String.format("Cluster '%s' has no writer instance, writer-only checks cannot run", clusterName));
    }
    
    public static CatalogException emptyCatalog() {
        return new CatalogException(ErrorCode.EMPTY_CATALOG, "No active health check definitions found");
    }
    
    public static CatalogException noInstances(String clusterName) {
        return new CatalogException(ErrorCode.NO_INSTANCES,
            String.format("Cluster '%s' has no instances", clusterName));
    }
}
