package com.quillflow.quillflow_backend.engine;

import java.util.UUID;

/**
 * Another instance now owns the task. The local run must stop without writing anything further.
 */
public class LeaseLostException extends RuntimeException {

    public LeaseLostException(UUID taskId, String owner) {
        super("Lease on task " + taskId + " is no longer held by " + owner);
    }
}
