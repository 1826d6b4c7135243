package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.AttemptOutcome;
import com.quillflow.quillflow_backend.model.domain.CostRecord;
import com.quillflow.quillflow_backend.model.dto.BudgetStatus;
import com.quillflow.quillflow_backend.model.dto.CostHistory;
import com.quillflow.quillflow_backend.model.dto.CostSummary;
import com.quillflow.quillflow_backend.repository.CostRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Append-only cost ledger and its read side. The billing period is the current calendar month in UTC.
 */
@Slf4j
@Service
public class CostMetricsService {

    private static final int SCALE = 6;
    private static final int DAYS_PER_MONTH = 30;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TREND_UP = new BigDecimal("1.1");
    private static final BigDecimal TREND_DOWN = new BigDecimal("0.9");

    private final CostRecordRepository costRecordRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    public CostMetricsService(CostRecordRepository costRecordRepository, PipelineProperties properties, Clock clock) {
        this.costRecordRepository = costRecordRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public CostRecord record(CostRecord costRecord) {
        CostRecord saved = costRecordRepository.save(costRecord);
        if (saved.getOutcome() != AttemptOutcome.SUCCESS) {
            log.debug("Recorded {} attempt for task {} phase {} on {}", saved.getOutcome(),
                    saved.getTaskId(), saved.getPhase(), saved.getProvider());
        }
        return saved;
    }

    public List<CostRecord> forTask(UUID taskId) {
        return costRecordRepository.findByTaskIdOrderByCreatedAtAsc(taskId);
    }

    public Instant periodStart() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        return today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** Daily average over the elapsed days of the period, today included, times 30. */
    public BigDecimal projectedMonthlySpend() {
        return project(dailyAverage(sum(currentPeriod())));
    }

    /**
     * Decides whether a new task with the given estimate deserves a budget warning.
     * The task's own ceiling is checked first, then the monthly projection.
     */
    public BudgetCheck checkBudget(BigDecimal estimatedCost, BigDecimal taskCeiling) {
        BigDecimal estimate = nz(estimatedCost);
        if (taskCeiling != null && estimate.compareTo(taskCeiling) > 0) {
            return BudgetCheck.warn("Estimated cost " + estimate.toPlainString()
                    + " exceeds the task budget ceiling " + taskCeiling.toPlainString());
        }
        BigDecimal monthly = properties.getBudget().getMonthlyBudget();
        if (monthly != null) {
            BigDecimal projected = projectedMonthlySpend().add(estimate);
            if (projected.compareTo(monthly) > 0) {
                return BudgetCheck.warn("Projected monthly spend " + projected.setScale(2, RoundingMode.HALF_UP).toPlainString()
                        + " would exceed the monthly budget " + monthly.toPlainString());
            }
        }
        return BudgetCheck.OK;
    }

    public CostSummary summary() {
        List<CostRecord> records = currentPeriod();
        BigDecimal total = sum(records);
        BigDecimal projected = project(dailyAverage(total));
        BigDecimal monthly = properties.getBudget().getMonthlyBudget();

        Map<String, BigDecimal> phases = new LinkedHashMap<>();
        Map<String, BigDecimal> providers = new LinkedHashMap<>();
        for (CostRecord r : records) {
            phases.merge(r.getPhase().key(), nz(r.getActualCost()), BigDecimal::add);
            providers.merge(r.getProvider().name(), nz(r.getActualCost()), BigDecimal::add);
        }
        return new CostSummary(periodStart(), phases, providers, total, dailyAverage(total), projected,
                monthly, monthly != null && projected.compareTo(monthly) > 0);
    }

    /**
     * Daily spend over the last 7 ("week") or 30 ("month") days, grouped by UTC date, with a
     * trend comparing the second half of the days against the first.
     */
    public CostHistory history(String period) {
        String normalized = period == null ? "week" : period.trim().toLowerCase(Locale.ROOT);
        int days = switch (normalized) {
            case "week" -> 7;
            case "month" -> 30;
            default -> throw new TaskValidationException("Unknown history period '" + period + "'; use week or month");
        };
        Instant now = clock.instant();
        Map<LocalDate, List<CostRecord>> byDate = new TreeMap<>();
        for (CostRecord r : costRecordRepository.findByCreatedAtGreaterThanEqual(now.minus(days, ChronoUnit.DAYS))) {
            if (r.getOutcome() == AttemptOutcome.SUCCESS) {
                byDate.computeIfAbsent(LocalDate.ofInstant(r.getCreatedAt(), ZoneOffset.UTC), d -> new ArrayList<>()).add(r);
            }
        }

        List<CostHistory.DailyCost> daily = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<LocalDate, List<CostRecord>> e : byDate.entrySet()) {
            BigDecimal cost = sum(e.getValue());
            int tasks = (int) e.getValue().stream().map(CostRecord::getTaskId).distinct().count();
            BigDecimal perTask = tasks > 0
                    ? cost.divide(BigDecimal.valueOf(tasks), SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO.setScale(SCALE);
            daily.add(new CostHistory.DailyCost(e.getKey(), cost, tasks, perTask));
            total = total.add(cost);
        }
        BigDecimal weeklyAverage = total.divide(BigDecimal.valueOf(Math.max(1, days / 7)), SCALE, RoundingMode.HALF_UP);
        return new CostHistory(normalized, daily, weeklyAverage, trend(daily), now);
    }

    /**
     * Spend against a monthly budget with tiered alerts at 80, 90 and 100 percent, plus an alert
     * when the projection runs more than 10% over. Months count as 30 days.
     */
    public BudgetStatus budgetStatus(BigDecimal monthlyBudget) {
        BigDecimal budget = monthlyBudget != null ? monthlyBudget : properties.getBudget().getMonthlyBudget();
        if (budget == null || budget.signum() <= 0) {
            throw new TaskValidationException("A positive monthly budget is required; none is configured");
        }
        BigDecimal spent = sum(currentPeriod());
        long elapsed = elapsedDays();
        BigDecimal burnRate = dailyAverage(spent);
        BigDecimal projected = project(burnRate);
        BigDecimal percentUsed = spent.multiply(HUNDRED).divide(budget, 2, RoundingMode.HALF_UP);

        List<BudgetStatus.Alert> alerts = new ArrayList<>();
        BudgetStatus.Health health;
        if (percentUsed.compareTo(HUNDRED) >= 0) {
            alerts.add(new BudgetStatus.Alert(BudgetStatus.Level.CRITICAL,
                    "Budget exceeded: spent " + money(spent) + " of " + money(budget), 100, percentUsed));
            health = BudgetStatus.Health.CRITICAL;
        } else if (percentUsed.compareTo(BigDecimal.valueOf(90)) >= 0) {
            alerts.add(new BudgetStatus.Alert(BudgetStatus.Level.WARNING,
                    "90% of the monthly budget used (" + money(spent) + ")", 90, percentUsed));
            health = BudgetStatus.Health.WARNING;
        } else if (percentUsed.compareTo(BigDecimal.valueOf(80)) >= 0) {
            alerts.add(new BudgetStatus.Alert(BudgetStatus.Level.WARNING,
                    "Approaching the budget limit at " + percentUsed.setScale(1, RoundingMode.HALF_UP) + "%", 80, percentUsed));
            health = BudgetStatus.Health.WARNING;
        } else {
            health = BudgetStatus.Health.HEALTHY;
        }
        if (projected.compareTo(budget.multiply(TREND_UP)) > 0) {
            alerts.add(new BudgetStatus.Alert(BudgetStatus.Level.WARNING,
                    "Projected monthly cost " + money(projected) + " exceeds the budget", 100,
                    projected.multiply(HUNDRED).divide(budget, 2, RoundingMode.HALF_UP)));
        }
        if (health != BudgetStatus.Health.HEALTHY) {
            log.warn("Monthly spend at {}% of budget {}", percentUsed, budget);
        }
        return new BudgetStatus(budget, spent, budget.subtract(spent).setScale(SCALE, RoundingMode.HALF_UP), percentUsed,
                DAYS_PER_MONTH, (int) Math.max(0, DAYS_PER_MONTH - elapsed), burnRate, projected, alerts, health,
                clock.instant());
    }

    private static CostHistory.Trend trend(List<CostHistory.DailyCost> daily) {
        int midpoint = daily.size() / 2;
        if (midpoint == 0) {
            return CostHistory.Trend.STABLE;
        }
        BigDecimal first = average(daily.subList(0, midpoint));
        BigDecimal second = average(daily.subList(midpoint, daily.size()));
        if (second.compareTo(first.multiply(TREND_UP)) > 0) return CostHistory.Trend.UP;
        if (second.compareTo(first.multiply(TREND_DOWN)) < 0) return CostHistory.Trend.DOWN;
        return CostHistory.Trend.STABLE;
    }

    private static BigDecimal average(List<CostHistory.DailyCost> days) {
        BigDecimal total = days.stream().map(CostHistory.DailyCost::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(days.size()), SCALE, RoundingMode.HALF_UP);
    }

    private List<CostRecord> currentPeriod() {
        return costRecordRepository.findByCreatedAtGreaterThanEqual(periodStart());
    }

    // days since the period started, counting today
    private long elapsedDays() {
        return ChronoUnit.DAYS.between(periodStart(), clock.instant()) + 1;
    }

    private BigDecimal dailyAverage(BigDecimal total) {
        return total.divide(BigDecimal.valueOf(elapsedDays()), SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal project(BigDecimal dailyAverage) {
        return dailyAverage.multiply(BigDecimal.valueOf(DAYS_PER_MONTH)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static String money(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static BigDecimal sum(List<CostRecord> records) {
        return records.stream()
                .map(r -> nz(r.getActualCost()))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public record BudgetCheck(boolean warning, String reason) {

        public static final BudgetCheck OK = new BudgetCheck(false, null);

        static BudgetCheck warn(String reason) {
            return new BudgetCheck(true, reason);
        }
    }
}
