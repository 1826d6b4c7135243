package com.quillflow.quillflow_backend.model.domain;

public enum ProviderTier {
    FREE_LOCAL,
    LOW_COST,
    PREMIUM
}
