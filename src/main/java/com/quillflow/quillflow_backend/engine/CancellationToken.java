package com.quillflow.quillflow_backend.engine;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Cooperative cancellation flag for one task run. Provider futures registered here are
 * cancelled together with the flag so a waiting phase unblocks immediately.
 */
public class CancellationToken {

    private final UUID taskId;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public CancellationToken(UUID taskId) {
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public void cancel() {
        cancelled = true;
        inFlight.forEach(f -> f.cancel(true));
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new TaskCancelledException(taskId);
        }
    }

    public void track(Future<?> future) {
        inFlight.add(future);
        // cancel() may have run between the flag check and the add
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
