package com.quillflow.quillflow_backend.model.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Named steps of the generation graph. Every phase except ASSESS is served by a model provider.
 */
public enum Phase {
    RESEARCH(true),
    OUTLINE(true),
    DRAFT(true),
    ASSESS(false),
    REFINE(true),
    FINALIZE(true);

    private final boolean usesProvider;

    Phase(boolean usesProvider) {
        this.usesProvider = usesProvider;
    }

    public boolean usesProvider() {
        return usesProvider;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<Phase> providerPhases() {
        return Arrays.stream(values()).filter(Phase::usesProvider).toList();
    }

    public static Phase fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Phase name is blank");
        }
        return Phase.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
