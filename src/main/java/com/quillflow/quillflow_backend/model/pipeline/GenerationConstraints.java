package com.quillflow.quillflow_backend.model.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Caller constraints after validation and defaulting. Fixed for the lifetime of a task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationConstraints {

    /** Target length in words. */
    private int targetLength;
    private String style;
    private String tone;
    private String audience;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /** 0-100. */
    private double qualityThreshold;
    private int maxRefinements;

    /** Optional ceiling for this task's estimated cost. */
    private BigDecimal budgetCeiling;
}
