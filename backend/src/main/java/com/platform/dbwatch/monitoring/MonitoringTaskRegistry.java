package com.platform.dbwatch.monitoring;

import com.platform.dbwatch.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sampling loops keyed by database id. At most one loop per database.
 *
 * A start reserves its database before touching the session record and turns the reservation
 * into a registered loop once the record is saved. A cancelled loop stays registered until its
 * in-flight cycle has finished, so a restart can never overlap the previous loop's last cycle.
 *
 * On context close every loop is cancelled; the session records stay active so that
 * {@link MonitoringRecoveryService} resumes them on the next start.
 */
@Slf4j
@Component
public class MonitoringTaskRegistry implements ApplicationListener<ContextClosedEvent> {

    private final Map<Long, SamplingTask> tasks = new ConcurrentHashMap<>();
    // guarded by this
    private final Set<Long> reservations = new HashSet<>();
    private final MetricsRegistry metricsRegistry;

    public MonitoringTaskRegistry(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Claim a database for a start in progress.
     * @return false if a loop is registered for the database or another start holds it
     */
    public synchronized boolean reserve(long databaseId) {
        if (tasks.containsKey(databaseId)) {
            return false;
        }
        return reservations.add(databaseId);
    }

    /**
     * Drop a reservation whose start failed before registering its loop.
     */
    public synchronized void release(long databaseId) {
        reservations.remove(databaseId);
    }

    /**
     * Register the loop of a start holding the reservation for its database.
     *
     * @throws IllegalStateException if the database was not reserved
     */
    public synchronized void registerReserved(SamplingTask task) {
        if (!reservations.remove(task.databaseId())) {
            throw new IllegalStateException("Database " + task.databaseId() + " was not reserved");
        }
        add(task);
    }

    /**
     * Register a loop for a database nobody has reserved.
     * @return false if the database already has a loop or a start in progress
     */
    public synchronized boolean register(SamplingTask task) {
        if (tasks.containsKey(task.databaseId()) || reservations.contains(task.databaseId())) {
            return false;
        }
        add(task);
        return true;
    }

    private void add(SamplingTask task) {
        tasks.put(task.databaseId(), task);
        metricsRegistry.sessionRegistered();
        log.debug("Registered {}", task);
    }

    /**
     * Remove the given loop. A newer loop registered for the same database is left alone.
     */
    public synchronized void unregister(SamplingTask task) {
        if (tasks.remove(task.databaseId(), task)) {
            metricsRegistry.sessionUnregistered();
            log.debug("Unregistered {}", task);
        }
    }

    /**
     * Cancel the loop driving the given session, if any. An idle loop is removed at once;
     * a loop with a cycle in flight is removed by that cycle when it ends.
     */
    public Optional<SamplingTask> cancelSession(long sessionId) {
        for (SamplingTask task : tasks.values()) {
            if (task.sessionId() == sessionId) {
                task.cancel();
                if (!task.isCycleInFlight()) {
                    unregister(task);
                } else {
                    log.debug("{} cancelled while a cycle is running", task);
                }
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    public Optional<SamplingTask> find(long databaseId) {
        return Optional.ofNullable(tasks.get(databaseId));
    }

    public int size() {
        return tasks.size();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        cancelAll();
    }

    public void cancelAll() {
        if (tasks.isEmpty()) {
            return;
        }
        log.info("Cancelling {} sampling loops", tasks.size());
        for (SamplingTask task : tasks.values()) {
            task.cancel();
            unregister(task);
        }
    }
}
