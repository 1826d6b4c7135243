package com.quillflow.quillflow_backend.router;

import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.llm.LlmFailureKind;

/**
 * One provider in a chain could not serve the call. Never leaves {@link ModelRouter}.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final LlmProvider provider;
    private final LlmFailureKind kind;

    public ProviderUnavailableException(LlmProvider provider, LlmFailureKind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public LlmFailureKind getKind() {
        return kind;
    }
}
