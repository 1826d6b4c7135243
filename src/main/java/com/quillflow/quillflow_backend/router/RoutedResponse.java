package com.quillflow.quillflow_backend.router;

import com.quillflow.quillflow_backend.model.domain.LlmProvider;

import java.math.BigDecimal;

/**
 * Text from the provider that served a phase, with what that successful call cost.
 *
 * @param attempts how many providers were tried, the successful one included
 */
public record RoutedResponse(
        String text,
        LlmProvider provider,
        String model,
        int inputTokens,
        int outputTokens,
        BigDecimal actualCost,
        int attempts
) {}
