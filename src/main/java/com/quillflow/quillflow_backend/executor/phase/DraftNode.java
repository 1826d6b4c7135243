package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.router.ModelRouter;
import com.quillflow.quillflow_backend.router.RoutedResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DraftNode implements PhaseNode {

    private static final int MAX_COMPLETION_TOKENS = 8000;

    private final ModelRouter router;

    @Override
    public Phase supportedPhase() {
        return Phase.DRAFT;
    }

    @Override
    public PipelineState execute(PipelineState state, PhaseContext context) {
        String prompt = PromptTemplates.draft(state.getTopic(), state.getConstraints(),
                state.getOutline(), state.getResearchNotes());
        LlmRequest request = LlmRequest.of(PromptTemplates.WRITER_SYSTEM, prompt,
                completionBudget(state.getConstraints().getTargetLength()), 0.7);
        RoutedResponse response = router.invoke(Phase.DRAFT, request, context);
        state.setDraft(response.text().trim());
        state.addCost(response.actualCost());
        return state;
    }

    /** Completion tokens for a full article of the given word count, with headroom for markup. */
    static int completionBudget(int targetLength) {
        return Math.min(MAX_COMPLETION_TOKENS, (int) Math.ceil(targetLength * 1.4) + 400);
    }
}
