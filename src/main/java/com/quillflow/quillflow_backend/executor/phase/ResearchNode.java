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
public class ResearchNode implements PhaseNode {

    private final ModelRouter router;

    @Override
    public Phase supportedPhase() {
        return Phase.RESEARCH;
    }

    @Override
    public PipelineState execute(PipelineState state, PhaseContext context) {
        LlmRequest request = LlmRequest.of(PromptTemplates.WRITER_SYSTEM,
                PromptTemplates.research(state.getTopic(), state.getConstraints()), 1500, 0.4);
        RoutedResponse response = router.invoke(Phase.RESEARCH, request, context);
        state.setResearchNotes(response.text());
        state.addCost(response.actualCost());
        return state;
    }
}
