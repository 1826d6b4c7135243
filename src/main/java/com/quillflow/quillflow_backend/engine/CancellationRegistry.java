package com.quillflow.quillflow_backend.engine;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tokens for runs executing in this process. The durable cancel flag lives in the task row;
 * this only lets a local cancel request interrupt an in-flight provider call without waiting
 * for the next snapshot.
 */
@Component
public class CancellationRegistry {

    private final Map<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();

    /** Starts a fresh token for a new run of the task, replacing any earlier run's token. */
    public CancellationToken register(UUID taskId) {
        CancellationToken token = new CancellationToken(taskId);
        tokens.put(taskId, token);
        return token;
    }

    public Optional<CancellationToken> find(UUID taskId) {
        return Optional.ofNullable(tokens.get(taskId));
    }

    /** Returns true when the task is running here and its token was cancelled. */
    public boolean cancel(UUID taskId) {
        CancellationToken token = tokens.get(taskId);
        if (token == null) return false;
        token.cancel();
        return true;
    }

    /** Drops the token if it still belongs to the given run. */
    public void release(UUID taskId, CancellationToken token) {
        tokens.remove(taskId, token);
    }
}
