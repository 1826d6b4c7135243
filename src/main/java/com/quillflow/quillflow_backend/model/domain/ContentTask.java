package com.quillflow.quillflow_backend.model.domain;

import com.quillflow.quillflow_backend.model.pipeline.Phase;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Durable record of one generation task. Written by the execution engine after every phase;
 * the snapshot column holds the full PipelineState so the recovery scan can resume from it.
 */
@Entity
@Table(name = "content_tasks")
@Data
public class ContentTask {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    // Last completed phase; null until research finishes
    @Enumerated(EnumType.STRING)
    private Phase phase;

    @Column(nullable = false, length = 500)
    private String topic;

    @Column(columnDefinition = "text")
    private String content;

    // title / excerpt / metaDescription and run facts written by finalize
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "refinement_count")
    private int refinementCount;

    @Column(name = "needs_review")
    private boolean needsReview;

    private double progress;

    @Column(name = "cost_so_far", precision = 14, scale = 6)
    private BigDecimal costSoFar = BigDecimal.ZERO;

    @Column(name = "estimated_cost", precision = 14, scale = 6)
    private BigDecimal estimatedCost;

    @Column(name = "budget_warning")
    private boolean budgetWarning;

    @Column(name = "budget_warning_reason")
    private String budgetWarningReason;

    // phase key -> ordered provider names
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "provider_selections")
    private Map<String, Object> providerSelections;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "state_snapshot")
    private Map<String, Object> stateSnapshot;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "cancel_requested")
    private boolean cancelRequested;

    @Column(name = "lease_owner")
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;
}
