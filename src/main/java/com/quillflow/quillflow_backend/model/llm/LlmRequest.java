package com.quillflow.quillflow_backend.model.llm;

/**
 * Provider-agnostic request that the phase nodes build.
 * Each LlmClient implementation translates this into its provider's API format.
 */
public class LlmRequest {

    private String systemPrompt;
    private String userPrompt;
    private String model;
    private int maxTokens = 1000;
    private double temperature = 0.7;
    private boolean jsonOutput;

    public LlmRequest() {}

    public static LlmRequest of(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        LlmRequest r = new LlmRequest();
        r.systemPrompt = systemPrompt;
        r.userPrompt = userPrompt;
        r.maxTokens = maxTokens;
        r.temperature = temperature;
        return r;
    }

    public String getSystemPrompt() { return systemPrompt; }
    public String getUserPrompt() { return userPrompt; }
    public String getModel() { return model; }
    public int getMaxTokens() { return maxTokens; }
    public double getTemperature() { return temperature; }
    public boolean isJsonOutput() { return jsonOutput; }

    public void setSystemPrompt(String s) { this.systemPrompt = s; }
    public void setUserPrompt(String s) { this.userPrompt = s; }
    public void setModel(String m) { this.model = m; }
    public void setMaxTokens(int n) { this.maxTokens = n; }
    public void setTemperature(double t) { this.temperature = t; }
    public void setJsonOutput(boolean b) { this.jsonOutput = b; }
}
