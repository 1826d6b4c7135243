package com.quillflow.quillflow_backend.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record BudgetStatus(
        BigDecimal monthlyBudget,
        BigDecimal amountSpent,
        BigDecimal amountRemaining,
        BigDecimal percentUsed,
        int daysInMonth,
        int daysRemaining,
        BigDecimal dailyBurnRate,
        BigDecimal projectedFinalCost,
        List<Alert> alerts,
        Health status,
        Instant generatedAt
) {

    public record Alert(Level level, String message, int thresholdPercent, BigDecimal currentPercent) {}

    public enum Level {
        WARNING,
        CRITICAL
    }

    public enum Health {
        HEALTHY,
        WARNING,
        CRITICAL
    }
}
