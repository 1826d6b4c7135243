package com.quillflow.quillflow_backend.executor.llm;

import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.llm.LlmResponse;

import java.math.BigDecimal;

/**
 * One generation backend. Implementations never throw for provider-side problems; they return
 * {@link LlmResponse#error} with a failure kind so the router can fall through to the next provider.
 */
public interface LlmClient {

    LlmProvider getProvider();

    String getDefaultModel();

    BigDecimal getCostPerThousandTokens();

    LlmResponse call(LlmRequest request, ProviderCredentials credentials);

    /** Rough count used for pricing before a call; about four characters per token. */
    default int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + 3) / 4;
    }
}
