package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.model.pipeline.GenerationConstraints;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.QualityAssessment;
import com.quillflow.quillflow_backend.quality.EvaluationContext;
import com.quillflow.quillflow_backend.quality.QualityEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores the current draft locally. Keeps track of the best draft so far so finalize
 * can fall back to it when refinement runs out without passing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssessNode implements PhaseNode {

    private final QualityEvaluator evaluator;

    @Override
    public Phase supportedPhase() {
        return Phase.ASSESS;
    }

    @Override
    public PipelineState execute(PipelineState state, PhaseContext context) {
        GenerationConstraints c = state.getConstraints();
        EvaluationContext evaluation = new EvaluationContext(state.getTopic(), c.getKeywords(),
                c.getTargetLength(), c.getQualityThreshold(), state.getRefinementCount());
        QualityAssessment assessment = evaluator.evaluate(state.getDraft(), evaluation);

        state.setQuality(assessment);
        state.getAssessments().add(assessment);
        // strictly greater keeps the earliest draft on ties
        if (state.getBestScore() == null || assessment.overallScore() > state.getBestScore()) {
            state.setBestScore(assessment.overallScore());
            state.setBestDraft(state.getDraft());
        }
        log.info("[Assess] task={} iteration={} score={} threshold={} passed={}", state.getTaskId(),
                assessment.iteration(), assessment.overallScore(), assessment.threshold(), assessment.passed());
        return state;
    }
}
