package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;

public interface PhaseNode {

    Phase supportedPhase();

    // Reads what earlier phases left in the state and writes this phase's output back into it
    PipelineState execute(PipelineState state, PhaseContext context);
}
