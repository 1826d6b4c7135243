package com.quillflow.quillflow_backend.model.pipeline;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Deterministic cost estimate for a full task. Maps preserve phase order and
 * first-seen provider order so equal inputs serialize identically.
 */
public record CostBreakdown(
        String preset,
        Map<String, BigDecimal> byPhase,
        Map<String, BigDecimal> byProvider,
        BigDecimal total,
        int tokenCount
) {}
