package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.model.pipeline.Phase;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PhaseNodeRegistry {

    private final List<PhaseNode> nodes;
    private final Map<Phase, PhaseNode> registry = new EnumMap<>(Phase.class);

    @PostConstruct
    public void init() {
        nodes.forEach(node -> registry.put(node.supportedPhase(), node));
    }

    public PhaseNode get(Phase phase) {
        PhaseNode node = registry.get(phase);
        if (node == null) {
            throw new UnsupportedOperationException("No node registered for phase: " + phase);
        }
        return node;
    }
}
