package com.quillflow.quillflow_backend.config;

import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.pipeline.QualityCriterion;
import com.quillflow.quillflow_backend.model.pipeline.RetryConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Lease owner name for this process. Generated when blank. */
    private String instanceId;
    private String defaultPreset = "balanced";

    private Quality quality = new Quality();
    private Execution execution = new Execution();
    private Streaming streaming = new Streaming();
    private Persistence persistence = new Persistence();
    private Recovery recovery = new Recovery();
    private Budget budget = new Budget();
    private Map<LlmProvider, ProviderSettings> providers = new EnumMap<>(LlmProvider.class);

    public synchronized String getInstanceId() {
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = "quillflow-" + UUID.randomUUID().toString().substring(0, 8);
        }
        return instanceId;
    }

    /**
     * Settings for one provider with enum defaults filled in for anything not configured.
     */
    public ProviderSettings provider(LlmProvider provider) {
        ProviderSettings configured = providers.get(provider);
        ProviderSettings merged = new ProviderSettings();
        merged.setEndpoint(configured != null && notBlank(configured.getEndpoint())
                ? configured.getEndpoint() : provider.getDefaultEndpoint());
        merged.setModel(configured != null && notBlank(configured.getModel())
                ? configured.getModel() : provider.getDefaultModel());
        merged.setApiKey(configured != null ? configured.getApiKey() : null);
        merged.setCostPerThousandTokens(configured != null && configured.getCostPerThousandTokens() != null
                ? configured.getCostPerThousandTokens() : provider.getDefaultCostPerThousandTokens());
        return merged;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    @Data
    public static class Quality {
        private double defaultThreshold = 80.0;
        private int defaultMaxRefinements = 3;
        private int maxRefinementsLimit = 10;
        /** Criteria scoring below this (0-10) produce feedback for the refine phase. */
        private double criterionFloor = 7.0;
        private Map<QualityCriterion, Double> weights = new EnumMap<>(QualityCriterion.defaultWeights());
    }

    @Data
    public static class Execution {
        private Duration providerCallTimeout = Duration.ofMinutes(2);
        private Duration overallTimeout = Duration.ofMinutes(15);
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
        private int contentPreviewChars = 280;
        private int defaultTargetLength = 1200;
        private int maxTargetLength = 10_000;
    }

    @Data
    public static class Streaming {
        /** Events retained per task for replay to late subscribers. */
        private int historyLimit = 64;
        /** Per-subscriber buffer; the oldest undelivered event is dropped on overflow. */
        private int subscriberBuffer = 32;
        private Duration channelRetention = Duration.ofMinutes(10);
        private Duration sseTimeout = Duration.ofMinutes(30);
        /** Open SSE streams per instance; one more is refused with 503. */
        private int maxConcurrentStreams = 128;
    }

    @Data
    public static class Persistence {
        private Duration writeTimeout = Duration.ofSeconds(10);
        private Duration leaseDuration = Duration.ofMinutes(10);
        private RetryConfig snapshotRetry = new RetryConfig();
    }

    @Data
    public static class Recovery {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
    }

    @Data
    public static class Budget {
        /** Monthly spend ceiling; null disables the projection check. */
        private BigDecimal monthlyBudget;
        private BudgetPolicy policy = BudgetPolicy.WARN;
    }

    public enum BudgetPolicy {
        WARN,
        BLOCK
    }

    @Data
    public static class ProviderSettings {
        private String endpoint;
        private String model;
        private String apiKey;
        private BigDecimal costPerThousandTokens;
    }
}
