package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;

/**
 * Edges of the generation graph:
 * <pre>
 * research -> outline -> draft -> assess --(passed or out of refinements)--> finalize
 *                                   ^  |
 *                                   |  +--(failed, refinements left)--> refine
 *                                   +-------------------------------------+
 * </pre>
 * Stateless; every decision is a function of the state alone.
 */
public final class PipelineGraph {

    /** Ceiling for progress until the task is stored as COMPLETED. */
    public static final double MAX_RUNNING_PROGRESS = 0.99;

    private PipelineGraph() {}

    /** Phase to run after {@code completed}, or null once finalize has run. {@code completed} null means nothing ran yet. */
    public static Phase next(Phase completed, PipelineState state) {
        if (completed == null) return Phase.RESEARCH;
        return switch (completed) {
            case RESEARCH -> Phase.OUTLINE;
            case OUTLINE -> Phase.DRAFT;
            case DRAFT, REFINE -> Phase.ASSESS;
            case ASSESS -> shouldRefine(state) ? Phase.REFINE : Phase.FINALIZE;
            case FINALIZE -> null;
        };
    }

    public static boolean shouldRefine(PipelineState state) {
        return state.getQuality() != null
                && !state.getQuality().passed()
                && state.getRefinementCount() < state.getConstraints().getMaxRefinements();
    }

    /** Fewest phases still needed after {@code completed} if every upcoming assessment passes. */
    public static int minimumRemaining(Phase completed, PipelineState state) {
        if (completed == null) return 5;
        return switch (completed) {
            case RESEARCH -> 4;
            case OUTLINE -> 3;
            case DRAFT, REFINE -> 2;
            case ASSESS -> shouldRefine(state) ? 3 : 1;
            case FINALIZE -> 0;
        };
    }

    /** Progress after {@code completed}, never below {@code previous}. Only completion reports 1.0. */
    public static double progressAfter(Phase completed, int invocations, PipelineState state, double previous) {
        int remaining = minimumRemaining(completed, state);
        double fraction = invocations + remaining == 0 ? 0.0 : (double) invocations / (invocations + remaining);
        return Math.min(MAX_RUNNING_PROGRESS, Math.max(previous, fraction));
    }

    /** Upper bound on phase invocations for a task allowed {@code maxRefinements} refine passes. */
    public static int maxInvocations(int maxRefinements) {
        return 5 + 2 * maxRefinements;
    }
}
