package com.quillflow.quillflow_backend.model.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Finalized output exposed to polling clients and carried by the terminal stream event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        String content,
        Map<String, Object> metadata,
        Double qualityScore,
        int refinementCount,
        boolean needsReview
) {}
