package com.quillflow.quillflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateTaskResponse(
        String taskId,
        TaskStatus status,
        BigDecimal estimatedCost,
        boolean budgetWarning,
        String budgetWarningReason,
        Subscription subscription
) {

    /** Where a streaming client attaches; present only when the request asked for streaming. */
    public record Subscription(String sseUrl, String stompTopic) {}
}
