package com.platform.dbwatch.monitoring;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory handle of one sampling loop. Cancellation is cooperative: a pending cycle is
 * cancelled without interruption and an in-flight cycle sees the flag before rescheduling.
 * 
 * The in-flight flag is set before the cancellation flag is read, and cancel sets its flag
 * before reading the in-flight one, so either the canceller or the running cycle observes the other.
 */
public final class SamplingTask {
    
    private final long sessionId;
    private final long databaseId;
    private final int intervalSeconds;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();
    
    public SamplingTask(long sessionId, long databaseId, int intervalSeconds) {
        this.sessionId = sessionId;
        this.databaseId = databaseId;
        this.intervalSeconds = intervalSeconds;
    }
    
    public long sessionId() {
        return sessionId;
    }
    
    public long databaseId() {
        return databaseId;
    }
    
    public int intervalSeconds() {
        return intervalSeconds;
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    public void cancel() {
        cancelled.set(true);
        ScheduledFuture<?> future = pending.getAndSet(null);
        if (future != null) {
            future.cancel(false);
        }
    }
    
    public boolean isCycleInFlight() {
        return cycleInFlight.get();
    }
    
    void beginCycle() {
        cycleInFlight.set(true);
    }
    
    void endCycle() {
        cycleInFlight.set(false);
    }
    
    void setPending(ScheduledFuture<?> future) {
        pending.set(future);
        // cancel() may have run between scheduling and this call
        if (cancelled.get()) {
            ScheduledFuture<?> stale = pending.getAndSet(null);
            if (stale != null) {
                stale.cancel(false);
            }
        }
    }
    
    @Override
    public String toString() {
        return "SamplingTask[session=" + sessionId + ", database=" + databaseId +
            ", interval=" + intervalSeconds + "s, cancelled=" + cancelled.get() +
            ", inFlight=" + cycleInFlight.get() + "]";
    }
}
