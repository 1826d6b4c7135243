package com.quillflow.quillflow_backend.model.pipeline;

import lombok.Data;

/**
 * Bounded retry policy for task-store writes, bound from pipeline.persistence.snapshot-retry.
 *
 * <pre>
 * snapshot-retry:
 *   max-retries: 3
 *   backoff-ms: 200
 *   backoff-multiplier: 2.0
 * </pre>
 */
@Data
public class RetryConfig {

    /**
     * Retries after the initial attempt. Clamped to [0, 10] by the writer.
     */
    private int maxRetries = 3;

    /**
     * Delay before the first retry.
     */
    private long backoffMs = 200L;

    /**
     * Applied to the delay after each failed attempt (200ms with 2.0 gives 200, 400, 800...).
     */
    private double backoffMultiplier = 2.0d;
}
