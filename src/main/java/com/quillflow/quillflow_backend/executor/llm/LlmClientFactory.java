package com.quillflow.quillflow_backend.executor.llm;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clients, PipelineProperties properties) {
        for (LlmClient client : clients) {
            clientMap.put(client.getProvider(), client);
        }
        // Groq and Mistral speak the OpenAI chat-completions dialect
        clientMap.putIfAbsent(LlmProvider.GROQ,
                new OpenAiCompatibleLlmClient(LlmProvider.GROQ, properties.provider(LlmProvider.GROQ)));
        clientMap.putIfAbsent(LlmProvider.MISTRAL,
                new OpenAiCompatibleLlmClient(LlmProvider.MISTRAL, properties.provider(LlmProvider.MISTRAL)));
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }

    public boolean isRegistered(LlmProvider provider) {
        return clientMap.containsKey(provider);
    }
}
