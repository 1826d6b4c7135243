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
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for a local Ollama server (/api/generate). Free tier, no API key.
 */
@Component
public class OllamaLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmClient.class);

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final PipelineProperties.ProviderSettings settings;

    public OllamaLlmClient(PipelineProperties properties) {
        this.settings = properties.provider(LlmProvider.OLLAMA);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OLLAMA;
    }

    @Override
    public String getDefaultModel() {
        return settings.getModel();
    }

    @Override
    public BigDecimal getCostPerThousandTokens() {
        return settings.getCostPerThousandTokens();
    }

    @Override
    public LlmResponse call(LlmRequest req, ProviderCredentials credentials) {
        String model = OpenAiCompatibleLlmClient.firstNonBlank(req.getModel(), credentials.model(), getDefaultModel());
        String url = credentials.endpoint() != null && !credentials.endpoint().isBlank()
                ? credentials.endpoint() : settings.getEndpoint();

        String fullPrompt = req.getUserPrompt();
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            fullPrompt = req.getSystemPrompt() + "\n\n" + fullPrompt;
        }

        HttpResponse<String> httpResp;
        try {
            Map<String, Object> options = new LinkedHashMap<>();
            options.put("temperature", req.getTemperature());
            if (req.getMaxTokens() > 0) {
                options.put("num_predict", req.getMaxTokens());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("prompt", fullPrompt);
            body.put("stream", false);
            body.put("options", options);
            if (req.isJsonOutput()) {
                body.put("format", "json");
            }

            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(180))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            httpResp = HttpExchanges.send(httpClient, httpReq);
        } catch (HttpTimeoutException e) {
            log.warn("[Ollama] request timed out");
            return LlmResponse.error(LlmFailureKind.TIMEOUT, "Ollama timed out");
        } catch (ConnectException e) {
            log.warn("[Ollama] not reachable at {}", url);
            return LlmResponse.error(LlmFailureKind.TRANSPORT, "Ollama not reachable at " + url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(LlmFailureKind.CANCELLED, "Ollama call interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.error("[Ollama] Exception calling API", e);
            return LlmResponse.error(LlmFailureKind.TRANSPORT, "Ollama client exception: " + e.getMessage());
        }

        if (httpResp.statusCode() != 200) {
            log.error("[Ollama] HTTP {}: {}", httpResp.statusCode(), extractError(httpResp.body()));
            return LlmResponse.error(LlmFailureKind.fromHttpStatus(httpResp.statusCode()),
                    "Ollama API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
        }

        try {
            JsonNode resp = mapper.readTree(httpResp.body());
            JsonNode text = resp.path("response");
            if (!text.isTextual() || text.asText().isBlank()) {
                return LlmResponse.error(LlmFailureKind.MALFORMED_RESPONSE, "Ollama returned no 'response' field");
            }
            // prompt_eval_count / eval_count are Ollama's token counters
            return LlmResponse.ok(text.asText().trim(), model,
                    resp.path("prompt_eval_count").asInt(0), resp.path("eval_count").asInt(0));
        } catch (IOException e) {
            return LlmResponse.error(LlmFailureKind.MALFORMED_RESPONSE, "Ollama returned unparseable JSON: " + e.getMessage());
        }
    }

    private String extractError(String body) {
        try {
            JsonNode err = mapper.readTree(body).path("error");
            if (!err.isMissingNode()) return err.asText();
        } catch (IOException e) {
            log.debug("[Ollama] error body is not JSON");
        }
        return OpenAiCompatibleLlmClient.fallbackBody(body);
    }
}
