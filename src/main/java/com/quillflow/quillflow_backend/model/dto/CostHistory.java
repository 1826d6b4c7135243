package com.quillflow.quillflow_backend.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily spend over the last week or month. Only days with at least one successful provider call appear.
 */
public record CostHistory(
        String period,
        List<DailyCost> days,
        BigDecimal weeklyAverage,
        Trend trend,
        Instant generatedAt
) {

    public record DailyCost(LocalDate date, BigDecimal cost, int tasks, BigDecimal averagePerTask) {}

    /** Second half of the window against the first, with a 10% band counted as stable. */
    public enum Trend {
        UP,
        DOWN,
        STABLE
    }
}
