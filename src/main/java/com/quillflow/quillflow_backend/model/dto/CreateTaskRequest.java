package com.quillflow.quillflow_backend.model.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Body of POST /api/tasks. Everything except topic is optional; defaults come from
 * pipeline.* configuration.
 *
 * @param providers optional phase name -> ordered provider names, overrides the preset per phase
 */
public record CreateTaskRequest(
        String topic,
        Integer targetLength,
        String style,
        String tone,
        String audience,
        List<String> keywords,
        String preset,
        Map<String, List<String>> providers,
        Double qualityThreshold,
        Integer maxRefinements,
        BigDecimal budgetCeiling,
        boolean stream
) {}
