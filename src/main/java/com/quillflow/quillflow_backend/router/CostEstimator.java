package com.quillflow.quillflow_backend.router;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.executor.llm.LlmClient;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.pipeline.CostBreakdown;
import com.quillflow.quillflow_backend.model.pipeline.ModelSelection;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prices phases and whole tasks from configured per-thousand-token rates. Never calls a provider
 * and never reads task history, so equal inputs always give equal breakdowns.
 */
@Component
public class CostEstimator {

    public static final int SCALE = 6;

    private static final Map<Phase, Integer> BASE_TOKENS;
    static {
        Map<Phase, Integer> m = new EnumMap<>(Phase.class);
        m.put(Phase.RESEARCH, 2000);
        m.put(Phase.OUTLINE, 1500);
        m.put(Phase.DRAFT, 3000);
        m.put(Phase.REFINE, 2000);
        m.put(Phase.FINALIZE, 1000);
        BASE_TOKENS = Collections.unmodifiableMap(m);
    }

    private static final double TOKENS_PER_WORD = 1.4;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final PipelineProperties properties;

    public CostEstimator(PipelineProperties properties) {
        this.properties = properties;
    }

    /** Token estimate for one phase; draft and refine grow with the target length. */
    public int phaseTokens(Phase phase, int targetLength) {
        int base = BASE_TOKENS.getOrDefault(phase, 0);
        if (phase == Phase.DRAFT || phase == Phase.REFINE) {
            return Math.max(base, (int) Math.ceil(targetLength * TOKENS_PER_WORD));
        }
        return base;
    }

    public BigDecimal price(LlmProvider provider, int tokens) {
        BigDecimal rate = properties.provider(provider).getCostPerThousandTokens();
        return BigDecimal.valueOf(tokens)
                .multiply(rate)
                .divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
    }

    /** Prompt tokens plus the full completion budget, priced at the client's rate. */
    public BigDecimal estimateCall(LlmClient client, LlmRequest request) {
        int tokens = estimateCallTokens(client, request);
        return BigDecimal.valueOf(tokens)
                .multiply(client.getCostPerThousandTokens())
                .divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
    }

    public int estimateCallTokens(LlmClient client, LlmRequest request) {
        return client.estimateTokens(request.getSystemPrompt())
                + client.estimateTokens(request.getUserPrompt())
                + request.getMaxTokens();
    }

    /**
     * Full-task estimate: one pass of every provider phase, each priced on the first provider of its chain.
     */
    public CostBreakdown estimate(ModelSelection selection, int targetLength) {
        Map<String, BigDecimal> byPhase = new LinkedHashMap<>();
        Map<String, BigDecimal> byProvider = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        int tokenCount = 0;

        for (Phase phase : Phase.providerPhases()) {
            LlmProvider primary = selection.primaryFor(phase);
            if (primary == null) continue;
            int tokens = phaseTokens(phase, targetLength);
            BigDecimal cost = price(primary, tokens);
            byPhase.put(phase.key(), cost);
            byProvider.merge(primary.name(), cost, BigDecimal::add);
            total = total.add(cost);
            tokenCount += tokens;
        }
        return new CostBreakdown(selection.preset(),
                Collections.unmodifiableMap(byPhase),
                Collections.unmodifiableMap(byProvider),
                total, tokenCount);
    }
}
