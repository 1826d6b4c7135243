package com.quillflow.quillflow_backend.controller;

import com.quillflow.quillflow_backend.executor.llm.LlmClient;
import com.quillflow.quillflow_backend.executor.llm.LlmClientFactory;
import com.quillflow.quillflow_backend.executor.llm.ProviderCredentials;
import com.quillflow.quillflow_backend.executor.llm.ProviderCredentialsResolver;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.domain.LlmProviderConfig;
import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.llm.LlmResponse;
import com.quillflow.quillflow_backend.repository.LlmProviderConfigRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Stored provider credentials (Settings → AI Providers). A stored row overrides
 * the pipeline.providers configuration for that provider.
 */
@RestController
@RequestMapping("/api/settings/llm-providers")
public class LlmProviderConfigController {

    private final LlmProviderConfigRepository repo;
    private final LlmClientFactory clientFactory;
    private final ProviderCredentialsResolver credentialsResolver;

    public LlmProviderConfigController(LlmProviderConfigRepository repo,
                                       LlmClientFactory clientFactory,
                                       ProviderCredentialsResolver credentialsResolver) {
        this.repo = repo;
        this.clientFactory = clientFactory;
        this.credentialsResolver = credentialsResolver;
    }

    public record ProviderSettingsRequest(String apiKey, String customEndpoint, String model, Boolean enabled) {}

    @GetMapping
    public List<Map<String, Object>> listProviders() {
        Map<LlmProvider, LlmProviderConfig> saved = repo.findAll()
                .stream()
                .collect(Collectors.toMap(LlmProviderConfig::getProvider, c -> c));

        return Arrays.stream(LlmProvider.values())
                .map(p -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("provider", p.name());
                    entry.put("displayName", p.getDisplayName());
                    entry.put("tier", p.getTier().name());
                    entry.put("requiresApiKey", p.requiresApiKey());
                    entry.put("defaultModel", clientFactory.isRegistered(p) ? clientFactory.getClient(p).getDefaultModel() : p.getDefaultModel());
                    entry.put("usable", credentialsResolver.resolve(p).isPresent());
                    LlmProviderConfig cfg = saved.get(p);
                    entry.put("stored", cfg != null);
                    entry.put("enabled", cfg == null || cfg.isEnabled());
                    entry.put("apiKeyMasked", cfg != null ? maskKey(cfg.getApiKey()) : null);
                    entry.put("customEndpoint", cfg != null ? cfg.getCustomEndpoint() : null);
                    entry.put("modelOverride", cfg != null ? cfg.getModelOverride() : null);
                    return entry;
                })
                .collect(Collectors.toList());
    }

    @PutMapping("/{provider}")
    public ResponseEntity<Map<String, Object>> saveProvider(@PathVariable String provider,
                                                            @RequestBody ProviderSettingsRequest body) {
        LlmProvider p = parseProvider(provider);
        LlmProviderConfig cfg = repo.findByProvider(p).orElseGet(LlmProviderConfig::new);
        boolean hasKey = body.apiKey() != null && !body.apiKey().isBlank();
        if (p.requiresApiKey() && !hasKey && (cfg.getApiKey() == null || cfg.getApiKey().isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "apiKey is required for " + p.getDisplayName());
        }

        cfg.setProvider(p);
        if (hasKey) cfg.setApiKey(body.apiKey().trim());
        cfg.setCustomEndpoint(blankToNull(body.customEndpoint()));
        cfg.setModelOverride(blankToNull(body.model()));
        cfg.setEnabled(body.enabled() == null || body.enabled());
        LlmProviderConfig saved = repo.save(cfg);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("provider", saved.getProvider().name());
        response.put("stored", true);
        response.put("enabled", saved.isEnabled());
        response.put("apiKeyMasked", maskKey(saved.getApiKey()));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<Void> deleteProvider(@PathVariable String provider) {
        LlmProvider p = parseProvider(provider);
        repo.findByProvider(p).ifPresent(repo::delete);
        return ResponseEntity.noContent().build();
    }

    // Sends a tiny prompt with the effective credentials
    @PostMapping("/{provider}/test")
    public ResponseEntity<Map<String, Object>> testProvider(@PathVariable String provider) {
        LlmProvider p = parseProvider(provider);
        ProviderCredentials credentials = credentialsResolver.resolve(p)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        p.getDisplayName() + " has no usable credentials"));
        LlmClient client = clientFactory.getClient(p);
        LlmRequest req = LlmRequest.of("You are a connectivity check. Answer briefly.", "Reply with the word OK.", 10, 0.0);

        long start = System.currentTimeMillis();
        LlmResponse resp = client.call(req, credentials);
        long latency = System.currentTimeMillis() - start;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", resp.isSuccess());
        result.put("latencyMs", latency);
        result.put("model", resp.isSuccess() ? resp.getModel() : credentials.model());
        result.put("message", resp.isSuccess() ? "Connected successfully" : resp.getErrorMessage());
        return ResponseEntity.ok(result);
    }

    private LlmProvider parseProvider(String s) {
        try {
            return LlmProvider.fromName(s);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + s);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private String maskKey(String key) {
        if (key == null) return null;
        if (key.length() < 10) return "****";
        return key.substring(0, 4) + "••••••••" + key.substring(key.length() - 4);
    }
}
