package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.pipeline.ModelPreset;
import com.quillflow.quillflow_backend.model.pipeline.ModelSelection;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a preset name plus optional per-phase provider lists into a {@link ModelSelection}.
 * Explicit lists replace the preset's chain for their phase only.
 */
@Component
@RequiredArgsConstructor
public class ModelSelectionResolver {

    private final PipelineProperties properties;

    public ModelSelection resolve(String presetName, Map<String, List<String>> overrides) {
        ModelPreset preset = parsePreset(presetName == null || presetName.isBlank()
                ? properties.getDefaultPreset() : presetName);
        ModelSelection selection = preset.toSelection();
        if (overrides == null || overrides.isEmpty()) {
            return selection;
        }
        return selection.withOverrides(parseOverrides(overrides));
    }

    private ModelPreset parsePreset(String name) {
        try {
            return ModelPreset.fromKey(name);
        } catch (IllegalArgumentException e) {
            throw new TaskValidationException("Unknown preset '" + name + "'. Expected one of: fast, balanced, quality");
        }
    }

    private Map<Phase, List<LlmProvider>> parseOverrides(Map<String, List<String>> overrides) {
        Map<Phase, List<LlmProvider>> parsed = new EnumMap<>(Phase.class);
        for (Map.Entry<String, List<String>> entry : overrides.entrySet()) {
            Phase phase;
            try {
                phase = Phase.fromKey(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new TaskValidationException("Provider override names unknown phase '" + entry.getKey() + "'");
            }
            if (!phase.usesProvider()) {
                throw new TaskValidationException("Phase '" + phase.key() + "' is scored locally and takes no provider");
            }
            if (parsed.containsKey(phase)) {
                throw new TaskValidationException("Phase '" + phase.key() + "' is overridden more than once");
            }
            List<String> names = entry.getValue();
            if (names == null || names.isEmpty()) {
                throw new TaskValidationException("Provider chain for phase '" + phase.key() + "' is empty");
            }
            Set<LlmProvider> chain = new LinkedHashSet<>();
            for (String name : names) {
                LlmProvider provider;
                try {
                    provider = LlmProvider.fromName(name);
                } catch (IllegalArgumentException e) {
                    throw new TaskValidationException("Unknown provider '" + name + "' for phase '" + phase.key() + "'");
                }
                if (!chain.add(provider)) {
                    throw new TaskValidationException("Provider " + provider + " listed twice for phase '" + phase.key() + "'");
                }
            }
            parsed.put(phase, new ArrayList<>(chain));
        }
        return parsed;
    }
}
