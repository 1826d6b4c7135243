package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.engine.CancellationToken;
import com.quillflow.quillflow_backend.model.pipeline.ModelSelection;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-run collaborators handed to every phase node alongside the state.
 */
public record PhaseContext(
        UUID taskId,
        ModelSelection selection,
        CancellationToken cancellation,
        Instant deadline
) {}
