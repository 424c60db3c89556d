package com.platform.dbwatch.observation;

/**
 * Identifier of the upserted row and whether it was inserted rather than updated.
 */
public record UpsertResult(long id, boolean created) {
    
    public static UpsertResult inserted(long id) {
        return new UpsertResult(id, true);
    }
    
    public static UpsertResult updated(long id) {
        return new UpsertResult(id, false);
    }
}
