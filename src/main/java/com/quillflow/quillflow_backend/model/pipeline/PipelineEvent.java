package com.quillflow.quillflow_backend.model.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One phase-boundary or terminal event on a task's stream.
 * Sequence numbers are assigned by the task's channel and start at 1.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineEvent(
        long sequence,
        String taskId,
        Phase phase,
        TaskStatus status,
        double progressFraction,
        Double qualityScore,
        BigDecimal costSoFar,
        String contentPreview,
        boolean terminal,
        TaskResult result,
        String error,
        Instant emittedAt
) {

    public PipelineEvent withSequence(long seq) {
        return new PipelineEvent(seq, taskId, phase, status, progressFraction, qualityScore,
                costSoFar, contentPreview, terminal, result, error, emittedAt);
    }
}
