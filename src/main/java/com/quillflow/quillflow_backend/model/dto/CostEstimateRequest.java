package com.quillflow.quillflow_backend.model.dto;

import java.util.List;
import java.util.Map;

public record CostEstimateRequest(
        String preset,
        Map<String, List<String>> providers,
        Integer targetLength
) {}
