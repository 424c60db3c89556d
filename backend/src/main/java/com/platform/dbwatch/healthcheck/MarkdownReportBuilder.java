package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.persistence.entity.ClusterEntity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a health check run as markdown: one section per definition, one sub-section
 * per instance and database, results in the order they were produced.
 */
@Component
public class MarkdownReportBuilder {
    
    static final String NO_ROWS = "_No rows returned._";
    
    public String build(ClusterEntity cluster, Instant generatedAt, List<HealthCheckDefinition> definitions,
                        List<HealthCheckResult> results) {
        StringBuilder md = new StringBuilder();
        md.append("# Health Check Report: ").append(escapeText(cluster.getName())).append("\n\n");
        md.append("- **Cluster:** ").append(escapeText(cluster.getName()))
            .append(" (id ").append(cluster.getId()).append(")\n");
        md.append("- **Generated:** ").append(generatedAt).append("\n");
        md.append("- **Summary:** ")
            .append(count(results, ResultStatus.SUCCESS)).append(" success, ")
            .append(count(results, ResultStatus.WARNING)).append(" warning, ")
            .append(count(results, ResultStatus.ERROR)).append(" error\n");
        
        for (HealthCheckDefinition definition : definitions) {
            md.append("\n## ").append(escapeText(definition.title())).append("\n");
            List<HealthCheckResult> forDefinition = results.stream()
                .filter(r -> r.definitionId() == definition.id())
                .toList();
            if (forDefinition.isEmpty()) {
                md.append("\n_No targets._\n");
                continue;
            }
            for (HealthCheckResult result : forDefinition) {
                appendResult(md, result);
            }
        }
        return md.toString();
    }
    
    private void appendResult(StringBuilder md, HealthCheckResult result) {
        md.append("\n### ").append(escapeText(result.instanceLabel()));
        if (result.databaseName() != null) {
            md.append(" / ").append(escapeText(result.databaseName()));
        }
        md.append("\n\n");
        
        switch (result.status()) {
            case ERROR -> {
                md.append("**Status: ERROR** ").append(escapeText(result.errorMessage())).append("\n");
                return;
            }
            case WARNING -> md.append("**Status: WARNING** ")
                .append(result.rowCount()).append(result.rowCount() == 1 ? " row" : " rows")
                .append(" need attention\n\n");
            case SUCCESS -> {
                // no status line
            }
        }
        
        if (result.rows().isEmpty()) {
            md.append(NO_ROWS).append("\n");
        } else {
            appendTable(md, result.rows());
        }
    }
    
    private void appendTable(StringBuilder md, List<Map<String, Object>> rows) {
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        
        md.append("|");
        for (String column : columns) {
            md.append(" ").append(escapeCell(column)).append(" |");
        }
        md.append("\n|");
        columns.forEach(c -> md.append(" --- |"));
        md.append("\n");
        
        for (Map<String, Object> row : rows) {
            md.append("|");
            for (String column : columns) {
                md.append(" ").append(escapeCell(row.get(column))).append(" |");
            }
            md.append("\n");
        }
    }
    
    static String escapeCell(Object value) {
        if (value == null) {
            return "NULL";
        }
        return String.valueOf(value)
            .replace("\\", "\\\\")
            .replace("|", "\\|")
            .replace("\r", " ")
            .replace("\n", " ");
    }
    
    private static String escapeText(String text) {
        return text == null ? "" : text.replace("\r", " ").replace("\n", " ");
    }
    
    private static long count(List<HealthCheckResult> results, ResultStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
