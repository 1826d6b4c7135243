package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.QualityAssessment;
import com.quillflow.quillflow_backend.router.ModelRouter;
import com.quillflow.quillflow_backend.router.RoutedResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Produces the next draft from the current one and the last assessment's feedback.
 */
@Component
@RequiredArgsConstructor
public class RefineNode implements PhaseNode {

    private final ModelRouter router;

    @Override
    public Phase supportedPhase() {
        return Phase.REFINE;
    }

    @Override
    public PipelineState execute(PipelineState state, PhaseContext context) {
        QualityAssessment quality = state.getQuality();
        String prompt = PromptTemplates.refine(state.getTopic(), state.getConstraints(), state.getDraft(),
                quality != null ? quality.feedback() : Map.of(),
                quality != null ? quality.overallScore() : 0.0);
        LlmRequest request = LlmRequest.of(PromptTemplates.WRITER_SYSTEM, prompt,
                DraftNode.completionBudget(state.getConstraints().getTargetLength()), 0.6);
        RoutedResponse response = router.invoke(Phase.REFINE, request, context);
        state.setDraft(response.text().trim());
        state.setRefinementCount(state.getRefinementCount() + 1);
        state.addCost(response.actualCost());
        return state;
    }
}
