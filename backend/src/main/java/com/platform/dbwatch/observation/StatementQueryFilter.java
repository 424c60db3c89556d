package com.platform.dbwatch.observation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter for listing canonical statements of one database. Every field is optional.
 */
@Value
@Builder
public class StatementQueryFilter {
    
    /** Lower bound on last seen, inclusive. */
    Instant from;
    
    /** Upper bound on last seen, inclusive. */
    Instant to;
    
    /** Case-insensitive substring matched against the raw text of any sample. */
    String search;
    
    /**
     * Known statements are hidden unless this is set. Ignored when {@link #known} is given.
     */
    boolean includeKnown;
    
    Boolean known;
    
    Long groupId;
    
    boolean ungroupedOnly;
    
    Integer limit;
    
    public static StatementQueryFilter unfiltered() {
        return StatementQueryFilter.builder().build();
    }
}
