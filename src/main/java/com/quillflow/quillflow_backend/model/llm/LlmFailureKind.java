package com.quillflow.quillflow_backend.model.llm;

/**
 * Why a provider call did not produce usable text. Every kind makes the router fall through
 * to the next provider in the chain, except CANCELLED which stops the task.
 */
public enum LlmFailureKind {
    TIMEOUT,
    RATE_LIMITED,
    SERVER_ERROR,
    CLIENT_ERROR,
    MALFORMED_RESPONSE,
    TRANSPORT,
    NOT_CONFIGURED,
    CANCELLED;

    public static LlmFailureKind fromHttpStatus(int status) {
        if (status == 429) return RATE_LIMITED;
        if (status == 408 || status == 504) return TIMEOUT;
        if (status >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
