package com.quillflow.quillflow_backend.model.domain;

import com.quillflow.quillflow_backend.model.pipeline.Phase;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One provider attempt for one phase. Rows are inserted once and never updated;
 * failed attempts carry a zero actual cost.
 */
@Entity
@Table(name = "cost_records", indexes = {
        @Index(name = "idx_cost_records_task", columnList = "task_id"),
        @Index(name = "idx_cost_records_created", columnList = "created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Phase phase;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private LlmProvider provider;

    @Column(updatable = false)
    private String model;

    @Column(name = "attempt", updatable = false)
    private int attempt;

    @Column(name = "estimated_cost", precision = 14, scale = 6, updatable = false)
    private BigDecimal estimatedCost;

    @Column(name = "actual_cost", precision = 14, scale = 6, updatable = false)
    private BigDecimal actualCost;

    @Column(name = "input_tokens", updatable = false)
    private int inputTokens;

    @Column(name = "output_tokens", updatable = false)
    private int outputTokens;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AttemptOutcome outcome;

    @Column(name = "error_message", columnDefinition = "text", updatable = false)
    private String errorMessage;

    @Column(name = "duration_ms", updatable = false)
    private long durationMs;

    @Builder.Default
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
}
