package com.platform.dbwatch.observation;

/**
 * Partial change to the manual classification of a canonical statement.
 * Null fields are left untouched; {@code clearGroup} wins over {@code groupId}.
 */
public record TriageUpdate(Boolean known, Long groupId, boolean clearGroup) {
    
    public static TriageUpdate markKnown(boolean known) {
        return new TriageUpdate(known, null, false);
    }
    
    public static TriageUpdate assignGroup(long groupId) {
        return new TriageUpdate(null, groupId, false);
    }
    
    public static TriageUpdate removeFromGroup() {
        return new TriageUpdate(null, null, true);
    }
}
