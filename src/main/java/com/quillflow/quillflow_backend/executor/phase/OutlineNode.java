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
public class OutlineNode implements PhaseNode {

    private final ModelRouter router;

    @Override
    public Phase supportedPhase() {
        return Phase.OUTLINE;
    }

    @Override
    public PipelineState execute(PipelineState state, PhaseContext context) {
        LlmRequest request = LlmRequest.of(PromptTemplates.WRITER_SYSTEM,
                PromptTemplates.outline(state.getTopic(), state.getConstraints(), state.getResearchNotes()), 1200, 0.5);
        RoutedResponse response = router.invoke(Phase.OUTLINE, request, context);
        state.setOutline(response.text());
        state.addCost(response.actualCost());
        return state;
    }
}
