package com.quillflow.quillflow_backend.controller;

import com.quillflow.quillflow_backend.model.dto.BudgetStatus;
import com.quillflow.quillflow_backend.model.dto.CostEstimateRequest;
import com.quillflow.quillflow_backend.model.dto.CostHistory;
import com.quillflow.quillflow_backend.model.dto.CostSummary;
import com.quillflow.quillflow_backend.model.pipeline.CostBreakdown;
import com.quillflow.quillflow_backend.service.ContentTaskService;
import com.quillflow.quillflow_backend.service.CostMetricsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/costs")
@RequiredArgsConstructor
public class CostController {

    private final ContentTaskService taskService;
    private final CostMetricsService costMetrics;

    // Pure estimate; no task is created and no provider is called
    @PostMapping("/estimate")
    public CostBreakdown estimate(@RequestBody CostEstimateRequest request) {
        return taskService.estimate(request);
    }

    @GetMapping("/summary")
    public CostSummary summary() {
        return costMetrics.summary();
    }

    @GetMapping("/history")
    public CostHistory history(@RequestParam(defaultValue = "week") String period) {
        return costMetrics.history(period);
    }

    // Falls back to the configured monthly budget when none is given
    @GetMapping("/budget")
    public BudgetStatus budget(@RequestParam(required = false) BigDecimal monthlyBudget) {
        return costMetrics.budgetStatus(monthlyBudget);
    }
}
