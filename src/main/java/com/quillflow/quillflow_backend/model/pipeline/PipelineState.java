package com.quillflow.quillflow_backend.model.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single mutable record carried through one task's graph execution.
 * Owned by exactly one worker at a time; serialized to the task store after every phase,
 * and a serialized copy is enough to resume from the phase after {@link #phase}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineState {

    private String taskId;
    private String topic;
    private GenerationConstraints constraints;
    private ModelSelection selection;

    /** Last completed phase, null before research has run. */
    private Phase phase;

    private String researchNotes;
    private String outline;
    private String draft;

    // Best-scoring draft seen by assess; finalize falls back to it when refinement runs out
    private String bestDraft;
    private Double bestScore;

    private String finalContent;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private QualityAssessment quality;

    @Builder.Default
    private List<QualityAssessment> assessments = new ArrayList<>();

    private int refinementCount;
    private int phaseInvocations;

    /** e.g. ["research", "outline", "draft", "assess(score=62.0, fail)", ...] */
    @Builder.Default
    private List<String> phaseTrace = new ArrayList<>();

    @Builder.Default
    private BigDecimal costSoFar = BigDecimal.ZERO;

    private double progressFraction;
    private boolean needsReview;

    private Instant createdAt;
    private Instant startedAt;
    private Instant updatedAt;
    private Instant deadline;

    public void addCost(BigDecimal amount) {
        if (amount != null) {
            costSoFar = (costSoFar == null ? BigDecimal.ZERO : costSoFar).add(amount);
        }
    }

    /** Text the assess/refine/finalize phases work on. */
    public String currentContent() {
        if (finalContent != null) return finalContent;
        return draft;
    }
}
