package com.quillflow.quillflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.TaskResult;

import java.math.BigDecimal;

/**
 * Poll response. {@code result} is set once the task completed, {@code error} once it failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
        String taskId,
        String topic,
        TaskStatus status,
        Phase phase,
        double progress,
        BigDecimal costSoFar,
        Double qualityScore,
        int refinementCount,
        boolean budgetWarning,
        TaskResult result,
        String error
) {}
