package com.platform.dbwatch.healthcheck;

import java.util.List;
import java.util.Map;

/**
 * Heuristic deciding whether a successful check result needs attention.
 */
public enum WarningRule {
    
    NONE {
        @Override
        public boolean flags(List<Map<String, Object>> rows) {
            return false;
        }
    },
    
    /**
     * The query lists objects at risk, so any row is a finding.
     */
    ANY_ROWS {
        @Override
        public boolean flags(List<Map<String, Object>> rows) {
            return rows != null && !rows.isEmpty();
        }
    };
    
    public abstract boolean flags(List<Map<String, Object>> rows);
}
