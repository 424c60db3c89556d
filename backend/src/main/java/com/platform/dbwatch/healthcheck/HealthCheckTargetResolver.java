package com.platform.dbwatch.healthcheck;

import com.platform.dbwatch.connectors.ConnectionLease;
import com.platform.dbwatch.connectors.ConnectionProvider;
import com.platform.dbwatch.connectors.TargetDescriptor;
import com.platform.dbwatch.persistence.entity.ClusterEntity;
import com.platform.dbwatch.persistence.entity.InstanceEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a definition's scope into concrete instances and database names.
 */
@Slf4j
@Component
public class HealthCheckTargetResolver {
    
    private final ConnectionProvider connectionProvider;
    private final String defaultDatabase;
    
    public HealthCheckTargetResolver(
            ConnectionProvider connectionProvider,
            @Value("${dbwatch.healthcheck.default-database:postgres}") String defaultDatabase) {
        this.connectionProvider = connectionProvider;
        this.defaultDatabase = defaultDatabase;
    }
    
    public List<InstanceEntity> instancesFor(HealthCheckDefinition definition, List<InstanceEntity> instances) {
        if (!definition.writerOnly()) {
            return instances;
        }
        return instances.stream().filter(InstanceEntity::isWriter).toList();
    }
    
    /**
     * Databases to run the definition against on one instance.
     * 
     * @throws com.platform.dbwatch.error.ConnectionException if the instance cannot be reached to enumerate databases
     * @throws com.platform.dbwatch.error.TargetExecutionException if the enumeration query fails
     */
    public List<String> databasesFor(HealthCheckDefinition definition, InstanceEntity instance, ClusterEntity cluster) {
        if (definition.databaseScope() == DatabaseScope.SINGLE_DATABASE) {
            return List.of(defaultDatabaseOf(instance));
        }
        
        List<String> enumerated;
        try (ConnectionLease lease = connectionProvider.resolve(instanceTarget(instance, defaultDatabaseOf(instance)))) {
            enumerated = connectionProvider.listUserDatabases(lease);
        }
        return applyClusterOverrides(enumerated, cluster);
    }
    
    public TargetDescriptor instanceTarget(InstanceEntity instance, String databaseName) {
        return TargetDescriptor.forInstance(instance, databaseName);
    }
    
    public String defaultDatabaseOf(InstanceEntity instance) {
        String name = instance.getDefaultDatabaseName();
        return name == null || name.isBlank() ? defaultDatabase : name;
    }
    
    /**
     * Ignored names are removed, then extra names appended in their configured order.
     */
    static List<String> applyClusterOverrides(List<String> enumerated, ClusterEntity cluster) {
        Set<String> ignored = cluster.getIgnoredDatabases() == null
            ? Set.of() : Set.copyOf(cluster.getIgnoredDatabases());
        Set<String> names = new LinkedHashSet<>();
        for (String name : enumerated) {
            if (!ignored.contains(name)) {
                names.add(name);
            }
        }
        if (cluster.getExtraDatabases() != null) {
            for (String extra : cluster.getExtraDatabases()) {
                if (extra != null && !extra.isBlank() && !ignored.contains(extra)) {
                    names.add(extra.trim());
                }
            }
        }
        return new ArrayList<>(names);
    }
    
    public static String label(InstanceEntity instance) {
        return instance.getHostname() + ":" + instance.getPort() + (instance.isWriter() ? " (writer)" : "");
    }
}
