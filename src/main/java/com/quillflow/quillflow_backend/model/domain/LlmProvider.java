package com.quillflow.quillflow_backend.model.domain;

import java.math.BigDecimal;

/**
 * Supported generation backends.
 * Each provider maps to a concrete LlmClient implementation and carries the defaults
 * used when no override is configured under pipeline.providers.
 */
public enum LlmProvider {

    OLLAMA("Ollama (local)",       ProviderTier.FREE_LOCAL, false, "http://localhost:11434/api/generate",              "llama3.1",                "0"),
    GROQ("Groq (Fast inference)",  ProviderTier.LOW_COST,   true,  "https://api.groq.com/openai/v1/chat/completions",  "llama-3.3-70b-versatile", "0.0006"),
    MISTRAL("Mistral AI",          ProviderTier.LOW_COST,   true,  "https://api.mistral.ai/v1/chat/completions",       "mistral-small-latest",    "0.0010"),
    OPENAI("OpenAI GPT",           ProviderTier.PREMIUM,    true,  "https://api.openai.com/v1/chat/completions",       "gpt-4o",                  "0.0050"),
    ANTHROPIC("Anthropic Claude",  ProviderTier.PREMIUM,    true,  "https://api.anthropic.com/v1/messages",            "claude-sonnet-4-5",       "0.0090");

    private final String displayName;
    private final ProviderTier tier;
    private final boolean requiresApiKey;
    private final String defaultEndpoint;
    private final String defaultModel;
    private final BigDecimal defaultCostPerThousandTokens;

    LlmProvider(String displayName, ProviderTier tier, boolean requiresApiKey,
                String defaultEndpoint, String defaultModel, String costPerThousandTokens) {
        this.displayName = displayName;
        this.tier = tier;
        this.requiresApiKey = requiresApiKey;
        this.defaultEndpoint = defaultEndpoint;
        this.defaultModel = defaultModel;
        this.defaultCostPerThousandTokens = new BigDecimal(costPerThousandTokens);
    }

    public String getDisplayName()                    { return displayName; }
    public ProviderTier getTier()                     { return tier; }
    public boolean requiresApiKey()                   { return requiresApiKey; }
    public String getDefaultEndpoint()                { return defaultEndpoint; }
    public String getDefaultModel()                   { return defaultModel; }
    public BigDecimal getDefaultCostPerThousandTokens() { return defaultCostPerThousandTokens; }

    /** Case-insensitive lookup; throws IllegalArgumentException for unknown names. */
    public static LlmProvider fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name is blank");
        }
        return LlmProvider.valueOf(name.trim().toUpperCase());
    }
}
