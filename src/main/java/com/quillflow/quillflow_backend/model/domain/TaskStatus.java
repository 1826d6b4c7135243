package com.quillflow.quillflow_backend.model.domain;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    RUNNING,
    AWAITING_REFINEMENT,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<TaskStatus> NON_TERMINAL = EnumSet.of(PENDING, RUNNING, AWAITING_REFINEMENT);

    public boolean isTerminal() {
        return !NON_TERMINAL.contains(this);
    }
}
