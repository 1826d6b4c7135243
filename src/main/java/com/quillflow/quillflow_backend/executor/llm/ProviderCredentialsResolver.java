package com.quillflow.quillflow_backend.executor.llm;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.domain.LlmProviderConfig;
import com.quillflow.quillflow_backend.repository.LlmProviderConfigRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stored settings (Settings → AI Providers) win over pipeline.providers configuration.
 * Empty when the provider needs a key and none is available, or when it was disabled.
 */
@Component
@RequiredArgsConstructor
public class ProviderCredentialsResolver {

    private final LlmProviderConfigRepository configRepository;
    private final PipelineProperties properties;

    public Optional<ProviderCredentials> resolve(LlmProvider provider) {
        PipelineProperties.ProviderSettings settings = properties.provider(provider);
        String apiKey = settings.getApiKey();
        String endpoint = settings.getEndpoint();
        String model = settings.getModel();

        Optional<LlmProviderConfig> stored = configRepository.findByProvider(provider);
        if (stored.isPresent()) {
            LlmProviderConfig cfg = stored.get();
            if (!cfg.isEnabled()) {
                return Optional.empty();
            }
            if (hasText(cfg.getApiKey())) apiKey = cfg.getApiKey();
            if (hasText(cfg.getCustomEndpoint())) endpoint = cfg.getCustomEndpoint();
            if (hasText(cfg.getModelOverride())) model = cfg.getModelOverride();
        }

        if (provider.requiresApiKey() && !hasText(apiKey)) {
            return Optional.empty();
        }
        return Optional.of(new ProviderCredentials(apiKey, endpoint, model));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
