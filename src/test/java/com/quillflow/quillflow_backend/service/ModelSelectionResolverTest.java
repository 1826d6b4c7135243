package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.pipeline.ModelSelection;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelSelectionResolverTest {

    private final ModelSelectionResolver resolver = new ModelSelectionResolver(new PipelineProperties());

    @Test
    @DisplayName("blank preset falls back to the configured default")
    void defaultPreset() {
        ModelSelection selection = resolver.resolve(null, null);
        assertEquals("balanced", selection.preset());
        assertEquals(List.of(LlmProvider.GROQ, LlmProvider.OPENAI, LlmProvider.OLLAMA), selection.chainFor(Phase.DRAFT));
    }

    @Test
    @DisplayName("override replaces only its own phase")
    void overrideOnePhase() {
        ModelSelection selection = resolver.resolve("fast", Map.of("draft", List.of("anthropic", "ollama")));

        assertEquals(List.of(LlmProvider.ANTHROPIC, LlmProvider.OLLAMA), selection.chainFor(Phase.DRAFT));
        assertEquals(List.of(LlmProvider.OLLAMA, LlmProvider.GROQ), selection.chainFor(Phase.RESEARCH));
        assertTrue(selection.chainFor(Phase.ASSESS).isEmpty());
    }

    @Test
    @DisplayName("invalid presets, phases and providers are rejected")
    void rejectsInvalidInput() {
        assertThrows(TaskValidationException.class, () -> resolver.resolve("turbo", null));
        assertThrows(TaskValidationException.class, () -> resolver.resolve("fast", Map.of("publish", List.of("groq"))));
        assertThrows(TaskValidationException.class, () -> resolver.resolve("fast", Map.of("assess", List.of("groq"))));
        assertThrows(TaskValidationException.class, () -> resolver.resolve("fast", Map.of("draft", List.of())));
        assertThrows(TaskValidationException.class, () -> resolver.resolve("fast", Map.of("draft", List.of("gemini"))));
        assertThrows(TaskValidationException.class,
                () -> resolver.resolve("fast", Map.of("draft", Arrays.asList("groq", "GROQ"))));
    }
}
