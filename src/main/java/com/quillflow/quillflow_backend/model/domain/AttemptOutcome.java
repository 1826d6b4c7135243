package com.quillflow.quillflow_backend.model.domain;

public enum AttemptOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    CANCELLED
}
