package com.quillflow.quillflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CostSummary(
        Instant periodStart,
        Map<String, BigDecimal> byPhase,
        Map<String, BigDecimal> byProvider,
        BigDecimal totalThisPeriod,
        BigDecimal dailyAverage,
        BigDecimal projectedMonthlySpend,
        BigDecimal monthlyBudget,
        boolean overBudget
) {}
