package com.quillflow.quillflow_backend.model.pipeline;

import com.quillflow.quillflow_backend.model.domain.LlmProvider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase to ordered fallback chain. Immutable once a task starts.
 *
 * @param preset preset the chains were derived from, or null when every chain was supplied explicitly
 */
public record ModelSelection(String preset, Map<Phase, List<LlmProvider>> chains) {

    public ModelSelection {
        Map<Phase, List<LlmProvider>> copy = new EnumMap<>(Phase.class);
        if (chains != null) {
            chains.forEach((phase, chain) -> copy.put(phase, List.copyOf(chain)));
        }
        chains = Collections.unmodifiableMap(copy);
    }

    public List<LlmProvider> chainFor(Phase phase) {
        return chains.getOrDefault(phase, List.of());
    }

    public LlmProvider primaryFor(Phase phase) {
        List<LlmProvider> chain = chainFor(phase);
        return chain.isEmpty() ? null : chain.get(0);
    }

    /** Returns a copy with the given phases' chains replaced. */
    public ModelSelection withOverrides(Map<Phase, List<LlmProvider>> overrides) {
        Map<Phase, List<LlmProvider>> merged = new EnumMap<>(Phase.class);
        merged.putAll(chains);
        merged.putAll(overrides);
        return new ModelSelection(preset, merged);
    }

    /** Plain string form stored in the task record. */
    public Map<String, Object> toStorageMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        chains.forEach((phase, chain) -> out.put(phase.key(), chain.stream().map(Enum::name).toList()));
        return out;
    }
}
