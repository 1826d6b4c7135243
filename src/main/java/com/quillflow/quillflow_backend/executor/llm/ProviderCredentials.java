package com.quillflow.quillflow_backend.executor.llm;

/**
 * Resolved connection details for one call. {@code apiKey} is null for keyless providers.
 */
public record ProviderCredentials(String apiKey, String endpoint, String model) {

    @Override
    public String toString() {
        return "ProviderCredentials[endpoint=" + endpoint + ", model=" + model + "]";
    }
}
