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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.*;

@Component
public class AnthropicLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final PipelineProperties.ProviderSettings settings;

    public AnthropicLlmClient(PipelineProperties properties) {
        this.settings = properties.provider(LlmProvider.ANTHROPIC);
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return settings.getModel(); }

    @Override
    public BigDecimal getCostPerThousandTokens() { return settings.getCostPerThousandTokens(); }

    @Override
    public LlmResponse call(LlmRequest req, ProviderCredentials credentials) {
        String url = credentials.endpoint() != null && !credentials.endpoint().isBlank()
                ? credentials.endpoint() : settings.getEndpoint();
        String model = OpenAiCompatibleLlmClient.firstNonBlank(req.getModel(), credentials.model(), getDefaultModel());
        HttpResponse<String> httpResp;
        try {
            List<Map<String, String>> messages = new ArrayList<>();
            messages.add(Map.of("role", "user", "content", req.getUserPrompt()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("max_tokens", req.getMaxTokens());
            body.put("temperature", req.getTemperature());
            body.put("messages", messages);
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                body.put("system", req.getSystemPrompt());
            }
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(90))
                    .header("Content-Type", "application/json")
                    .header("x-api-key", credentials.apiKey())
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            httpResp = HttpExchanges.send(httpClient, httpReq);
        } catch (HttpTimeoutException e) {
            log.warn("[Anthropic] request timed out");
            return LlmResponse.error(LlmFailureKind.TIMEOUT, "Anthropic timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(LlmFailureKind.CANCELLED, "Anthropic call interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.error("[Anthropic] Exception calling API", e);
            return LlmResponse.error(LlmFailureKind.TRANSPORT, "Anthropic client exception: " + e.getMessage());
        }

        if (httpResp.statusCode() != 200) {
            log.error("[Anthropic] HTTP {}", httpResp.statusCode());
            // 529 is Anthropic's "overloaded"
            LlmFailureKind kind = httpResp.statusCode() == 529
                    ? LlmFailureKind.RATE_LIMITED : LlmFailureKind.fromHttpStatus(httpResp.statusCode());
            return LlmResponse.error(kind, "Anthropic API error " + httpResp.statusCode() + ": " + extractErrorMessage(httpResp.body()));
        }

        try {
            JsonNode resp = mapper.readTree(httpResp.body());
            StringBuilder text = new StringBuilder();
            for (JsonNode block : resp.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    text.append(block.path("text").asText());
                }
            }
            if (text.length() == 0) {
                return LlmResponse.error(LlmFailureKind.MALFORMED_RESPONSE, "Anthropic returned no text content");
            }
            JsonNode usage = resp.path("usage");
            return LlmResponse.ok(text.toString(), resp.path("model").asText(model),
                    usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0));
        } catch (IOException e) {
            return LlmResponse.error(LlmFailureKind.MALFORMED_RESPONSE, "Anthropic returned unparseable JSON: " + e.getMessage());
        }
    }

    private String extractErrorMessage(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (msg.isTextual()) return msg.asText();
        } catch (IOException e) {
            log.debug("[Anthropic] error body is not JSON");
        }
        return OpenAiCompatibleLlmClient.fallbackBody(body);
    }
}
