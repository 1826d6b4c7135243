package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.model.pipeline.Phase;

import java.time.Duration;

/**
 * The task's overall wall-clock deadline passed. Terminal for the task.
 */
public class PipelineTimeoutException extends RuntimeException {

    public PipelineTimeoutException(Phase phase, Duration overallTimeout) {
        super("Task exceeded overall timeout of " + overallTimeout + " during " + (phase != null ? phase.key() : "startup"));
    }
}
