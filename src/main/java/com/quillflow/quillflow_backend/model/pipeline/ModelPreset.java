package com.quillflow.quillflow_backend.model.pipeline;

import com.quillflow.quillflow_backend.model.domain.LlmProvider;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.quillflow.quillflow_backend.model.domain.LlmProvider.*;

/**
 * Named provider strategies. Chains run cheapest-first for "fast" and best-first for "quality".
 */
public enum ModelPreset {

    FAST {
        @Override
        Map<Phase, List<LlmProvider>> chains() {
            Map<Phase, List<LlmProvider>> m = new EnumMap<>(Phase.class);
            for (Phase p : Phase.providerPhases()) {
                m.put(p, List.of(OLLAMA, GROQ));
            }
            return m;
        }
    },
    BALANCED {
        @Override
        Map<Phase, List<LlmProvider>> chains() {
            Map<Phase, List<LlmProvider>> m = new EnumMap<>(Phase.class);
            m.put(Phase.RESEARCH, List.of(OLLAMA, GROQ));
            m.put(Phase.OUTLINE,  List.of(OLLAMA, GROQ));
            m.put(Phase.DRAFT,    List.of(GROQ, OPENAI, OLLAMA));
            m.put(Phase.REFINE,   List.of(GROQ, OPENAI, OLLAMA));
            m.put(Phase.FINALIZE, List.of(OPENAI, GROQ, OLLAMA));
            return m;
        }
    },
    QUALITY {
        @Override
        Map<Phase, List<LlmProvider>> chains() {
            Map<Phase, List<LlmProvider>> m = new EnumMap<>(Phase.class);
            m.put(Phase.RESEARCH, List.of(OPENAI, ANTHROPIC, GROQ));
            m.put(Phase.OUTLINE,  List.of(OPENAI, ANTHROPIC, GROQ));
            m.put(Phase.DRAFT,    List.of(ANTHROPIC, OPENAI, GROQ));
            m.put(Phase.REFINE,   List.of(ANTHROPIC, OPENAI, GROQ));
            m.put(Phase.FINALIZE, List.of(ANTHROPIC, OPENAI, GROQ));
            return m;
        }
    };

    abstract Map<Phase, List<LlmProvider>> chains();

    public ModelSelection toSelection() {
        return new ModelSelection(key(), chains());
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ModelPreset fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Preset name is blank");
        }
        return ModelPreset.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
