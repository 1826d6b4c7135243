package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.model.pipeline.TaskResult;

/**
 * The one place a stored task becomes a client-facing view. The poll endpoint, the blocking run
 * and the terminal stream event all go through here so they report the same result.
 */
public final class TaskViewMapper {

    private TaskViewMapper() {}

    public static TaskView toView(ContentTask task) {
        return new TaskView(
                task.getId().toString(),
                task.getTopic(),
                task.getStatus(),
                task.getPhase(),
                task.getProgress(),
                task.getCostSoFar(),
                task.getQualityScore(),
                task.getRefinementCount(),
                task.isBudgetWarning(),
                toResult(task),
                task.getStatus() == TaskStatus.FAILED ? task.getError() : null
        );
    }

    /** Null unless the task completed. */
    public static TaskResult toResult(ContentTask task) {
        if (task.getStatus() != TaskStatus.COMPLETED) {
            return null;
        }
        return new TaskResult(task.getContent(), task.getMetadata(), task.getQualityScore(),
                task.getRefinementCount(), task.isNeedsReview());
    }
}
