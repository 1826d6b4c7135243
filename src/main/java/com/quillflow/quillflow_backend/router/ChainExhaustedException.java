package com.quillflow.quillflow_backend.router;

import com.quillflow.quillflow_backend.model.pipeline.Phase;

import java.util.List;

/**
 * Every provider in a phase's fallback chain failed. Terminal for the task.
 */
public class ChainExhaustedException extends RuntimeException {

    private final Phase phase;
    private final List<String> failures;

    public ChainExhaustedException(Phase phase, List<String> failures) {
        super("All providers failed for phase " + phase.key()
                + (failures.isEmpty() ? " (empty chain)" : ": " + String.join("; ", failures)));
        this.phase = phase;
        this.failures = List.copyOf(failures);
    }

    public Phase getPhase() {
        return phase;
    }

    public List<String> getFailures() {
        return failures;
    }
}
