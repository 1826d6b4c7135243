package com.quillflow.quillflow_backend.executor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.llm.LlmFailureKind;
import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI chat-completions client. The no-provider constructor registers OpenAI itself;
 * {@link LlmClientFactory} builds further instances for Groq and Mistral.
 */
@Component
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLlmClient.class);

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    private final LlmProvider provider;
    private final String defaultEndpoint;
    private final String defaultModel;
    private final BigDecimal costPerThousandTokens;

    @Autowired
    public OpenAiCompatibleLlmClient(PipelineProperties properties) {
        this(LlmProvider.OPENAI, properties.provider(LlmProvider.OPENAI));
    }

    public OpenAiCompatibleLlmClient(LlmProvider provider, PipelineProperties.ProviderSettings settings) {
        this.provider = provider;
        this.defaultEndpoint = settings.getEndpoint();
        this.defaultModel = settings.getModel();
        this.costPerThousandTokens = settings.getCostPerThousandTokens();
    }

    @Override
    public LlmProvider getProvider() { return provider; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    public BigDecimal getCostPerThousandTokens() { return costPerThousandTokens; }

    @Override
    public LlmResponse call(LlmRequest req, ProviderCredentials credentials) {
        String url = credentials.endpoint() != null && !credentials.endpoint().isBlank()
                ? credentials.endpoint() : defaultEndpoint;
        String model = firstNonBlank(req.getModel(), credentials.model(), defaultModel);
        HttpResponse<String> httpResp;
        try {
            List<Map<String, String>> messages = new ArrayList<>();
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
            }
            messages.add(Map.of("role", "user", "content", req.getUserPrompt()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("max_tokens", req.getMaxTokens());
            body.put("temperature", req.getTemperature());
            if (req.isJsonOutput()) {
                body.put("response_format", Map.of("type", "json_object"));
            }
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(90))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + credentials.apiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            httpResp = HttpExchanges.send(httpClient, httpReq);
        } catch (HttpTimeoutException e) {
            log.warn("[{}] request timed out", provider);
            return LlmResponse.error(LlmFailureKind.TIMEOUT, provider.getDisplayName() + " timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(LlmFailureKind.CANCELLED, provider.getDisplayName() + " call interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.error("[{}] Exception calling API", provider, e);
            return LlmResponse.error(LlmFailureKind.TRANSPORT, provider.getDisplayName() + " client exception: " + e.getMessage());
        }

        if (httpResp.statusCode() != 200) {
            log.error("[{}] HTTP {}", provider, httpResp.statusCode());
            return LlmResponse.error(LlmFailureKind.fromHttpStatus(httpResp.statusCode()),
                    provider.getDisplayName() + " API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
        }
        return parse(httpResp.body(), model);
    }

    LlmResponse parse(String responseBody, String requestedModel) {
        try {
            JsonNode resp = mapper.readTree(responseBody);
            JsonNode content = resp.path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                return LlmResponse.error(LlmFailureKind.MALFORMED_RESPONSE,
                        provider.getDisplayName() + " returned no message content");
            }
            JsonNode usage = resp.path("usage");
            int inputTokens = usage.path("prompt_tokens").asInt(0);
            int outputTokens = usage.path("completion_tokens").asInt(0);
            String usedModel = resp.path("model").asText(requestedModel);
            return LlmResponse.ok(content.asText(), usedModel, inputTokens, outputTokens);
        } catch (IOException e) {
            return LlmResponse.error(LlmFailureKind.MALFORMED_RESPONSE,
                    provider.getDisplayName() + " returned unparseable JSON: " + e.getMessage());
        }
    }

    private String extractError(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (msg.isTextual()) return msg.asText();
        } catch (IOException e) {
            log.debug("[{}] error body is not JSON", provider);
        }
        return fallbackBody(body);
    }

    static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }

    static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
