package com.quillflow.quillflow_backend.model.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one assess-phase invocation. A later assessment is a new record, never an update.
 *
 * @param scores       per-criterion scores, 0-10
 * @param overallScore weighted average scaled to 0-100
 * @param feedback     correction instruction per criterion that scored below the floor
 * @param iteration    refinement count at the time of the assessment
 */
public record QualityAssessment(
        Map<QualityCriterion, Double> scores,
        double overallScore,
        double threshold,
        boolean passed,
        Map<QualityCriterion, String> feedback,
        int iteration,
        Instant assessedAt
) {
    public QualityAssessment {
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(copyOf(scores));
        feedback = feedback == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(feedback));
    }

    private static Map<QualityCriterion, Double> copyOf(Map<QualityCriterion, Double> source) {
        Map<QualityCriterion, Double> copy = new EnumMap<>(QualityCriterion.class);
        copy.putAll(source);
        return copy;
    }
}
