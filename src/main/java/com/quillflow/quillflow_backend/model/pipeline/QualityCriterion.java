package com.quillflow.quillflow_backend.model.pipeline;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public enum QualityCriterion {
    CLARITY(0.15),
    ACCURACY(0.15),
    COMPLETENESS(0.15),
    RELEVANCE(0.15),
    STRUCTURE(0.10),
    READABILITY(0.15),
    ENGAGEMENT(0.15);

    private final double defaultWeight;

    QualityCriterion(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public static Map<QualityCriterion, Double> defaultWeights() {
        Map<QualityCriterion, Double> weights = new EnumMap<>(QualityCriterion.class);
        for (QualityCriterion c : values()) {
            weights.put(c, c.defaultWeight);
        }
        return Collections.unmodifiableMap(weights);
    }
}
