package com.quillflow.quillflow_backend.quality;

import java.util.List;

/**
 * What the evaluator needs to know about the task besides the text itself.
 *
 * @param targetLength target length in words
 * @param threshold    pass mark, 0-100
 * @param iteration    refinement count at the time of assessment
 */
public record EvaluationContext(
        String topic,
        List<String> keywords,
        int targetLength,
        double threshold,
        int iteration
) {
    public EvaluationContext {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
