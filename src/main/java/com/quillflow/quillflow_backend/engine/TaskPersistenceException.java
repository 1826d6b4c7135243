package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.model.pipeline.Phase;

public class TaskPersistenceException extends RuntimeException {

    private final Phase phase;

    public TaskPersistenceException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public Phase getPhase() {
        return phase;
    }
}
