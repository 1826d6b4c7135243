package com.quillflow.quillflow_backend.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 * The raw text is always the model's reply.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private LlmFailureKind failureKind;
    private int     inputTokens;   // 0 when the provider does not report usage
    private int     outputTokens;
    private String  model;         // actual model used (provider may differ from requested)

    public LlmResponse() {}

    public static LlmResponse ok(String rawText, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.rawText      = rawText;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(LlmFailureKind kind, String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.failureKind  = kind;
        r.errorMessage = message;
        return r;
    }

    // ── Getters + Setters ──────────────────────────────────────────────────

    public boolean isSuccess()                 { return success; }
    public String getRawText()                 { return rawText; }
    public String getErrorMessage()            { return errorMessage; }
    public LlmFailureKind getFailureKind()     { return failureKind; }
    public int getInputTokens()                { return inputTokens; }
    public int getOutputTokens()               { return outputTokens; }
    public String getModel()                   { return model; }

    public void setSuccess(boolean b)          { this.success = b; }
    public void setRawText(String s)           { this.rawText = s; }
    public void setErrorMessage(String s)      { this.errorMessage = s; }
    public void setFailureKind(LlmFailureKind k) { this.failureKind = k; }
    public void setInputTokens(int n)          { this.inputTokens = n; }
    public void setOutputTokens(int n)         { this.outputTokens = n; }
    public void setModel(String m)             { this.model = m; }
}
